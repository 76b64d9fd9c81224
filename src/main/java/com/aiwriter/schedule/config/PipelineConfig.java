package com.aiwriter.schedule.config;

import com.aiwriter.schedule.capture.ChangeCaptureFilter;
import com.aiwriter.schedule.core.codec.ScheduledContentParser;
import com.aiwriter.schedule.core.model.DomainEvent;
import com.aiwriter.schedule.core.port.AuditSink;
import com.aiwriter.schedule.core.port.DistributionService;
import com.aiwriter.schedule.core.port.EventBusPublisher;
import com.aiwriter.schedule.core.port.JobSchedulerClient;
import com.aiwriter.schedule.core.schedule.ScheduleTimeCompiler;
import com.aiwriter.schedule.dispatch.DispatchEntryPoint;
import com.aiwriter.schedule.dispatch.LoggingDistributionService;
import com.aiwriter.schedule.jetstream.scheduler.JetStreamJobSchedulerClient;
import com.aiwriter.schedule.jetstream.scheduler.JobFirer;
import com.aiwriter.schedule.registrar.ScheduleCreator;
import com.aiwriter.schedule.registrar.ScheduleRegistrar;
import com.aiwriter.schedule.routing.EventRoute;
import com.aiwriter.schedule.routing.EventRouter;
import com.aiwriter.schedule.routing.LoggingAuditSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.KeyValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wires the pipeline stages:
 *
 * <pre>
 * change feed → ChangeCaptureFilter → bus → EventRouter → ScheduleCreator
 *             → ScheduleTimeCompiler + ScheduleRegistrar → JobSchedulerClient
 *             → (JobFirer) → dispatch subject → DispatchEntryPoint → DistributionService
 * </pre>
 *
 * Stage classes are plain Java; only the consumers and stores are Spring components.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public ScheduledContentParser scheduledContentParser(ObjectMapper mapper) {
        return new ScheduledContentParser(mapper);
    }

    @Bean
    public ChangeCaptureFilter changeCaptureFilter(ScheduledContentParser parser) {
        return new ChangeCaptureFilter(parser);
    }

    @Bean
    public ScheduleTimeCompiler scheduleTimeCompiler(SchedulingProperties scheduling) {
        ScheduleTimeCompiler compiler = new ScheduleTimeCompiler(scheduling.resolveZone());
        log.info("Schedules are interpreted in zone {}", compiler.zone());
        return compiler;
    }

    @Bean
    @ConditionalOnMissingBean(JobSchedulerClient.class)
    public JobSchedulerClient jobSchedulerClient(KeyValue jobBucket, ObjectMapper mapper, Clock clock) {
        return new JetStreamJobSchedulerClient(jobBucket, mapper, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "contentsched.scheduling", name = "firer-enabled", havingValue = "true", matchIfMissing = true)
    public JobFirer jobFirer(KeyValue jobBucket, EventBusPublisher publisher, ObjectMapper mapper, Clock clock,
                             SchedulingProperties scheduling) {
        return new JobFirer(jobBucket, publisher, mapper, clock, scheduling.getFireInterval());
    }

    /**
     * The target is resolved once here; a missing group or target fails startup.
     */
    @Bean
    public ScheduleRegistrar scheduleRegistrar(JobSchedulerClient scheduler, ScheduleTargetProperties target,
                                               SchedulingProperties scheduling, ObjectMapper mapper) {
        SchedulingProperties.Registration retry = scheduling.getRegistration();
        return new ScheduleRegistrar(scheduler, target.toScheduleTarget(), target.getContext(), mapper,
                retry.getMaxRetries(), retry.getFirstBackoff(), retry.getMaxBackoff());
    }

    @Bean
    public ScheduleCreator scheduleCreator(ScheduleTimeCompiler compiler, ScheduleRegistrar registrar, Clock clock) {
        return new ScheduleCreator(compiler, registrar, clock);
    }

    @Bean
    @ConditionalOnMissingBean(AuditSink.class)
    public AuditSink auditSink(ObjectMapper mapper) {
        return new LoggingAuditSink(mapper);
    }

    @Bean
    public EventRouter eventRouter(ScheduleCreator scheduleCreator, AuditSink auditSink) {
        List<EventRoute> routes = List.of(new EventRoute(
                "schedule-creator",
                DomainEvent.SOURCE_SCHEDULED_CONTENT,
                DomainEvent.DETAIL_TYPE_CREATED,
                scheduleCreator));
        return new EventRouter(routes, auditSink);
    }

    @Bean
    @ConditionalOnMissingBean(DistributionService.class)
    public DistributionService distributionService() {
        return new LoggingDistributionService();
    }

    @Bean
    public DispatchEntryPoint dispatchEntryPoint(ScheduledContentParser parser, DistributionService distribution) {
        return new DispatchEntryPoint(parser, distribution);
    }
}
