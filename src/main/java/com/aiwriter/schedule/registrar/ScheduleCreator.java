package com.aiwriter.schedule.registrar;

import com.aiwriter.schedule.core.error.MalformedEventException;
import com.aiwriter.schedule.core.error.PastScheduleException;
import com.aiwriter.schedule.core.model.DomainEvent;
import com.aiwriter.schedule.core.model.FireExpression;
import com.aiwriter.schedule.core.model.ScheduledContentRecord;
import com.aiwriter.schedule.core.schedule.ScheduleTimeCompiler;
import com.aiwriter.schedule.routing.DomainEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Route handler for {@code ScheduleContentCreated}: compiles the record's schedule and
 * registers the job.
 *
 * <p>The clock is read once per event. A schedule that is already in the past, or whose
 * wall-clock time is skipped by a clock change, is logged and dropped; redelivering the
 * event could never make it valid.</p>
 */
public class ScheduleCreator implements DomainEventHandler {

    private static final Logger log = LoggerFactory.getLogger(ScheduleCreator.class);

    private final ScheduleTimeCompiler compiler;
    private final ScheduleRegistrar registrar;
    private final Clock clock;

    public ScheduleCreator(ScheduleTimeCompiler compiler, ScheduleRegistrar registrar, Clock clock) {
        this.compiler = compiler;
        this.registrar = registrar;
        this.clock = clock;
    }

    @Override
    public Mono<Void> handle(DomainEvent event) {
        return Mono.defer(() -> {
            ScheduledContentRecord record = event.detail().scheduledContent();
            Instant now = clock.instant();

            FireExpression fire;
            try {
                fire = compiler.compile(record.schedule(), now);
            } catch (PastScheduleException e) {
                log.warn("Schedule is in the past; not registering recordId={} schedule={} candidate={} diffMinutes={}",
                        record.id(), record.schedule(), e.getCandidate(), e.getDiffMinutes());
                return Mono.empty();
            } catch (MalformedEventException e) {
                log.warn("Schedule does not exist in zone; not registering recordId={} schedule={} err={}",
                        record.id(), record.schedule(), e.getMessage());
                return Mono.empty();
            }

            log.info("Compiled schedule recordId={} schedule={} fire={}", record.id(), record.schedule(), fire);
            return registrar.register(record, fire).then();
        });
    }
}
