package com.aiwriter.schedule.registrar;

import com.aiwriter.schedule.core.error.RegistrationException;
import com.aiwriter.schedule.core.model.DispatchPayload;
import com.aiwriter.schedule.core.model.DisposalPolicy;
import com.aiwriter.schedule.core.model.FireExpression;
import com.aiwriter.schedule.core.model.ScheduleJob;
import com.aiwriter.schedule.core.model.ScheduleTarget;
import com.aiwriter.schedule.core.model.ScheduledContentRecord;
import com.aiwriter.schedule.core.port.JobCreation;
import com.aiwriter.schedule.core.port.JobSchedulerClient;
import com.aiwriter.schedule.core.port.SchedulerServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * =====================================================================
 * ScheduleRegistrar
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Creates the one-shot job that will hand a record to the dispatch entry
 * point when its time comes.
 *
 * JOB SHAPE
 * ---------
 * - name        "<record.id>-scheduled-post"
 * - description "Post <id> scheduled by <userId>"
 * - payload     {"scheduledContent": <record>, "context": <context tag>}
 * - target      injected {@link ScheduleTarget}
 * - disposal    DELETE_AFTER_FIRE, flexible window OFF
 *
 * IDEMPOTENCE
 * -----------
 * The job name is derived from the record id. A second registration of the
 * same record finds the name taken; the scheduler answers ALREADY_EXISTS,
 * which completes normally. The stored job is not updated.
 *
 * FAILURES
 * --------
 * Transient scheduler failures are retried with exponential backoff. Anything
 * else, or an exhausted retry budget, raises {@link RegistrationException}.
 */
public class ScheduleRegistrar {

    private static final Logger log = LoggerFactory.getLogger(ScheduleRegistrar.class);

    private final JobSchedulerClient scheduler;
    private final ScheduleTarget target;
    private final String context;
    private final ObjectMapper mapper;
    private final int maxRetries;
    private final Duration firstBackoff;
    private final Duration maxBackoff;

    public ScheduleRegistrar(
            JobSchedulerClient scheduler,
            ScheduleTarget target,
            String context,
            ObjectMapper mapper,
            int maxRetries,
            Duration firstBackoff,
            Duration maxBackoff
    ) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.target = Objects.requireNonNull(target, "target");
        this.context = Objects.requireNonNull(context, "context");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.maxRetries = Math.max(0, maxRetries);
        this.firstBackoff = firstBackoff;
        this.maxBackoff = maxBackoff;
    }

    public Mono<ScheduleJob> register(ScheduledContentRecord record, FireExpression fireExpression) {
        return Mono.defer(() -> {
            ScheduleJob job = buildJob(record, fireExpression);

            return Mono.defer(() -> scheduler.createJob(job))
                    .retryWhen(retrySpec(job))
                    .onErrorMap(err -> !(err instanceof RegistrationException),
                            err -> new RegistrationException(job.name(), isTransient(err), err.getMessage(), err))
                    .map(outcome -> {
                        if (outcome == JobCreation.ALREADY_EXISTS) {
                            log.info("Job already registered; leaving it unchanged name={} group={}",
                                    job.name(), target.groupRef());
                        } else {
                            log.info("Registered job name={} group={} fireAt={}",
                                    job.name(), target.groupRef(), fireExpression);
                        }
                        return job;
                    });
        });
    }

    ScheduleJob buildJob(ScheduledContentRecord record, FireExpression fireExpression) {
        String name = ScheduleJob.nameFor(record.id());
        byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(new DispatchPayload(record, context));
        } catch (JsonProcessingException e) {
            throw new RegistrationException(name, false, "payload not serializable", e);
        }

        return new ScheduleJob(
                name,
                ScheduleJob.descriptionFor(record.id(), record.userId()),
                target,
                payload,
                fireExpression,
                DisposalPolicy.DELETE_AFTER_FIRE,
                ScheduleJob.FLEXIBLE_WINDOW_OFF
        );
    }

    private Retry retrySpec(ScheduleJob job) {
        return Retry.backoff(maxRetries, firstBackoff)
                .maxBackoff(maxBackoff)
                .filter(ScheduleRegistrar::isTransient)
                .doBeforeRetry(signal -> log.warn("Transient scheduler failure; retrying name={} attempt={} err={}",
                        job.name(), signal.totalRetries() + 1, signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) -> new RegistrationException(job.name(), true,
                        "gave up after " + signal.totalRetries() + " retries", signal.failure()));
    }

    static boolean isTransient(Throwable err) {
        if (err instanceof SchedulerServiceException sse) {
            return sse.isTransient();
        }
        return err instanceof IOException || err instanceof TimeoutException;
    }
}
