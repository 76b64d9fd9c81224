package com.aiwriter.schedule.capture;

import com.aiwriter.schedule.config.SchedulingProperties;
import com.aiwriter.schedule.core.error.MalformedEventException;
import com.aiwriter.schedule.core.model.ChangeFeedEntry;
import com.aiwriter.schedule.core.model.DomainEvent;
import com.aiwriter.schedule.core.port.EventBusPublisher;
import com.aiwriter.schedule.jetstream.config.ContentSchedulerProperties;
import com.aiwriter.schedule.jetstream.consumer.AbstractPullConsumer;
import com.aiwriter.schedule.jetstream.consumer.AckDecision;
import com.aiwriter.schedule.jetstream.naming.ConsumerName;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Reads the change feed and puts a {@code ScheduleContentCreated} event on the bus for every
 * newly inserted scheduled content record.
 *
 * <ul>
 *   <li>Irrelevant entries (other kinds, other entities) are ACKed.</li>
 *   <li>Malformed entries are logged and ACKed; one bad row must not stall the feed.</li>
 *   <li>A failed bus publish NAKs the entry so the feed redelivers it.</li>
 * </ul>
 *
 * <p>Bus message id is {@code <recordId>-ScheduleContentCreated}: a redelivered feed entry is
 * dropped by the bus stream instead of creating a second event.</p>
 */
@Component
@ConditionalOnProperty(prefix = "contentsched.capture", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ChangeFeedConsumer extends AbstractPullConsumer {

    private static final Logger log = LoggerFactory.getLogger(ChangeFeedConsumer.class);

    private final ChangeCaptureFilter filter;
    private final EventBusPublisher bus;
    private final ObjectMapper mapper;
    private final SchedulingProperties scheduling;

    public ChangeFeedConsumer(
            JetStream js,
            ContentSchedulerProperties props,
            SchedulingProperties scheduling,
            ChangeCaptureFilter filter,
            EventBusPublisher bus,
            ObjectMapper mapper,
            @Value("${contentsched.capture.stream:CHANGE_FEED}") String stream,
            @Value("${contentsched.capture.poll-interval:1s}") Duration pollInterval,
            @Value("${contentsched.capture.batch-size:3}") int batchSize
    ) {
        super(js, stream, scheduling.getChangeFeedSubject(),
                ConsumerName.of(props.getService(), "changefeed", props.getNodeId()),
                pollInterval, batchSize, Duration.ZERO);
        this.filter = filter;
        this.bus = bus;
        this.mapper = mapper;
        this.scheduling = scheduling;
    }

    @Override
    protected Mono<AckDecision> handle(Message msg) {
        ChangeFeedEntry entry;
        Optional<DomainEvent> event;
        try {
            entry = mapper.readValue(msg.getData(), ChangeFeedEntry.class);
            event = filter.filter(entry);
        } catch (IOException | MalformedEventException e) {
            log.warn("Dropping malformed change feed entry subject={} err={}", msg.getSubject(), e.getMessage());
            return Mono.just(AckDecision.ACK);
        }

        if (event.isEmpty()) {
            log.debug("Ignoring change id={} kind={} entityType={}", entry.changeId(), entry.eventKind(), entry.entityType());
            return Mono.just(AckDecision.ACK);
        }
        return publish(event.get());
    }

    Mono<AckDecision> publish(DomainEvent event) {
        String recordId = event.detail().scheduledContent().id();
        String subject = scheduling.eventSubject(event.source(), event.detailType());
        String messageId = recordId + "-" + event.detailType();

        byte[] body;
        try {
            body = mapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize event recordId={} err={}", recordId, e.getMessage(), e);
            return Mono.just(AckDecision.TERM);
        }

        return bus.publish(subject, messageId, body)
                .doOnSuccess(v -> log.info("Captured scheduled content recordId={} subject={}", recordId, subject))
                .thenReturn(AckDecision.ACK)
                .onErrorResume(err -> {
                    log.warn("Bus publish failed; change will be redelivered recordId={} err={}", recordId, err.toString());
                    return Mono.just(AckDecision.NAK);
                });
    }
}
