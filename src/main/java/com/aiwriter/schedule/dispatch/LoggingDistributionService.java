package com.aiwriter.schedule.dispatch;

import com.aiwriter.schedule.core.model.DispatchPayload;
import com.aiwriter.schedule.core.model.ScheduledContentRecord;
import com.aiwriter.schedule.core.port.DistributionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Default distributor: records that the post went out. Replace with a real channel integration.
 */
public class LoggingDistributionService implements DistributionService {

    private static final Logger log = LoggerFactory.getLogger(LoggingDistributionService.class);

    @Override
    public Mono<Void> distribute(DispatchPayload payload) {
        return Mono.fromRunnable(() -> {
            ScheduledContentRecord c = payload.scheduledContent();
            log.info("Distributing post recordId={} userId={} source={} context={}",
                    c.id(), c.userId(), c.sourceContentId(), payload.context());
        });
    }
}
