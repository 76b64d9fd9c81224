package com.aiwriter.schedule.routing;

import com.aiwriter.schedule.config.SchedulingProperties;
import com.aiwriter.schedule.core.codec.ScheduledContentParser;
import com.aiwriter.schedule.core.error.MalformedEventException;
import com.aiwriter.schedule.core.error.RegistrationException;
import com.aiwriter.schedule.core.model.DomainEvent;
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
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Feeds bus events into the {@link EventRouter} and maps the outcome onto the message:
 *
 * <ul>
 *   <li>success → ACK</li>
 *   <li>unparseable event → TERM</li>
 *   <li>transient {@link RegistrationException} → NAK with delay (redelivery is the retry)</li>
 *   <li>permanent {@link RegistrationException} → TERM + alert on the {@code operator.alerts} channel</li>
 *   <li>anything else → NAK with delay</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(prefix = "contentsched.routing", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EventBusConsumer extends AbstractPullConsumer {

    private static final Logger log = LoggerFactory.getLogger(EventBusConsumer.class);
    private static final Logger alerts = LoggerFactory.getLogger("operator.alerts");

    private final ScheduledContentParser parser;
    private final EventRouter router;

    public EventBusConsumer(
            JetStream js,
            ContentSchedulerProperties props,
            SchedulingProperties scheduling,
            ScheduledContentParser parser,
            EventRouter router,
            @Value("${contentsched.routing.stream:SCHEDULED_CONTENT_EVENTS}") String stream,
            @Value("${contentsched.routing.poll-interval:1s}") Duration pollInterval,
            @Value("${contentsched.routing.batch-size:10}") int batchSize,
            @Value("${contentsched.routing.nak-delay:30s}") Duration nakDelay
    ) {
        super(js, stream, scheduling.getEventSubjectPrefix() + ".>",
                ConsumerName.of(props.getService(), "eventbus", props.getNodeId()),
                pollInterval, batchSize, nakDelay);
        this.parser = parser;
        this.router = router;
    }

    @Override
    protected Mono<AckDecision> handle(Message msg) {
        DomainEvent event;
        try {
            event = parser.parseEvent(msg.getData());
        } catch (MalformedEventException e) {
            log.warn("Dropping unparseable bus event subject={} err={}", msg.getSubject(), e.getMessage());
            return Mono.just(AckDecision.TERM);
        }

        String recordId = event.detail().scheduledContent().id();
        return router.route(event)
                .thenReturn(AckDecision.ACK)
                .onErrorResume(err -> Mono.just(decide(recordId, err)));
    }

    static AckDecision decide(String recordId, Throwable err) {
        List<Throwable> failures = Exceptions.unwrapMultiple(err);
        boolean permanent = false;
        for (Throwable t : failures) {
            if (t instanceof RegistrationException re && !re.isTransient()) {
                permanent = true;
                alerts.error("Job registration failed permanently; manual action required recordId={} job={} err={}",
                        recordId, re.getJobName(), re.getMessage());
            }
        }
        if (permanent) {
            return AckDecision.TERM;
        }
        log.warn("Event handling failed; will redeliver recordId={} err={}", recordId, err.toString());
        return AckDecision.NAK_WITH_DELAY;
    }
}
