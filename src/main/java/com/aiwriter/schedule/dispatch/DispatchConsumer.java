package com.aiwriter.schedule.dispatch;

import com.aiwriter.schedule.config.ScheduleTargetProperties;
import com.aiwriter.schedule.core.error.DispatchException;
import com.aiwriter.schedule.jetstream.config.ContentSchedulerProperties;
import com.aiwriter.schedule.jetstream.consumer.AbstractPullConsumer;
import com.aiwriter.schedule.jetstream.consumer.AckDecision;
import com.aiwriter.schedule.jetstream.naming.ConsumerName;
import io.nats.client.JetStream;
import io.nats.client.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Consumes fired job payloads from the dispatch subject.
 *
 * <p>Failures are TERMinated, never redelivered: a fired job runs at most once.</p>
 */
@Component
@ConditionalOnProperty(prefix = "contentsched.dispatch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DispatchConsumer extends AbstractPullConsumer {

    private static final Logger log = LoggerFactory.getLogger(DispatchConsumer.class);

    private final DispatchEntryPoint entryPoint;

    public DispatchConsumer(
            JetStream js,
            ContentSchedulerProperties props,
            ScheduleTargetProperties target,
            DispatchEntryPoint entryPoint,
            @Value("${contentsched.dispatch.stream:CONTENT_DISPATCH}") String stream,
            @Value("${contentsched.dispatch.poll-interval:1s}") Duration pollInterval,
            @Value("${contentsched.dispatch.batch-size:10}") int batchSize
    ) {
        super(js, stream, target.getTargetRef(),
                ConsumerName.of(props.getService(), "dispatch", props.getNodeId()),
                pollInterval, batchSize, Duration.ZERO);
        this.entryPoint = entryPoint;
    }

    @Override
    protected Mono<AckDecision> handle(Message msg) {
        return entryPoint.handle(msg.getData())
                .thenReturn(AckDecision.ACK)
                .onErrorResume(err -> {
                    if (err instanceof DispatchException) {
                        log.error("Dispatch failed; post will not be retried subject={} err={}",
                                msg.getSubject(), err.getMessage(), err);
                    } else {
                        log.error("Unexpected dispatch failure subject={} err={}", msg.getSubject(), err.toString(), err);
                    }
                    return Mono.just(AckDecision.TERM);
                });
    }
}
