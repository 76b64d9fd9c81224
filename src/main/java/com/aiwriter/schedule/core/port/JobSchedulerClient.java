package com.aiwriter.schedule.core.port;

import com.aiwriter.schedule.core.model.ScheduleJob;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * JobSchedulerClient
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Transport-facing contract of the external one-shot job scheduler.
 *
 *   [ ScheduleRegistrar ]
 *          │ createJob
 *          ▼
 *   [ JobSchedulerClient ]  ← implemented by an adapter
 *          │
 *          ▼
 *   [ Scheduler service ] ── fires at fireExpression ──▶ [ target ]
 *
 * CONTRACT
 * --------
 * - Exactly one create attempt per call; retries are the caller's decision
 * - A name that already exists in the job group completes with
 *   {@link JobCreation#ALREADY_EXISTS} and leaves the stored job untouched
 * - Every other failure errors with {@link SchedulerServiceException}
 *
 * THREAD SAFETY
 * -------------
 * Implementations are singletons and must be thread-safe.
 */
public interface JobSchedulerClient {

    Mono<JobCreation> createJob(ScheduleJob job);
}
