package com.aiwriter.schedule.jetstream.publisher;

import com.aiwriter.schedule.core.port.EventBusPublisher;
import io.nats.client.JetStream;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reactive JetStream publisher used for the change feed, the event bus and job firing.
 *
 * <h2>De-duplication rule (LOCKED)</h2>
 * <ul>
 *   <li>{@code Msg-Id == messageId} supplied by the caller.</li>
 *   <li>Callers derive the id from the identity of what they publish (change id, record id,
 *       job name), so a retried publish is dropped by the stream inside its duplicate window.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * {@link JetStream#publish(String, byte[], PublishOptions)} blocks for the server ack, so it
 * runs on {@link Schedulers#boundedElastic()}.
 */
@Component
public class JetStreamEventBusPublisher implements EventBusPublisher {

    private static final Logger log = LoggerFactory.getLogger(JetStreamEventBusPublisher.class);

    private final JetStream js;

    public JetStreamEventBusPublisher(JetStream js) {
        this.js = js;
    }

    @Override
    public Mono<Void> publish(String subject, String messageId, byte[] body) {
        return Mono.fromCallable(() -> {
                    PublishOptions opts = PublishOptions.builder()
                            .messageId(messageId)
                            .build();

                    PublishAck ack = js.publish(subject, body == null ? new byte[0] : body, opts);

                    if (ack.isDuplicate()) {
                        log.info("Duplicate publish dropped by stream msgId={} subject={} stream={}",
                                messageId, subject, ack.getStream());
                    } else {
                        log.debug("Published msgId={} subject={} stream={} seq={}",
                                messageId, subject, ack.getStream(), ack.getSeqno());
                    }
                    return ack;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }
}
