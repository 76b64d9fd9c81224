package com.aiwriter.schedule.jetstream.bootstrap;

/**
 * =====================================================================
 * JetStreamBootstrapCompleteEvent
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Signals that the pipeline's streams and job bucket exist and match their
 * configuration, so consumers and the job firer may start.
 *
 *   ┌─────────────────────┐
 *   │ JetStream Bootstrap │
 *   └──────────┬──────────┘
 *              │ publishes
 *              ▼
 *   ┌─────────────────────┐
 *   │ Consumers / Firer   │
 *   └─────────────────────┘
 *
 * Published once by {@link JetStreamBootstrapper}. No payload: presence
 * means readiness. Listeners must be idempotent because they also start on
 * {@code ApplicationReadyEvent} when bootstrapping is disabled.
 */
public record JetStreamBootstrapCompleteEvent() {
}
