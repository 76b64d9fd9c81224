package com.aiwriter.schedule.core.port;

import com.aiwriter.schedule.core.model.DispatchPayload;
import reactor.core.publisher.Mono;

/**
 * Downstream service that actually distributes a post once its time has come.
 */
public interface DistributionService {

    Mono<Void> distribute(DispatchPayload payload);
}
