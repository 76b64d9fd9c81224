package com.aiwriter.schedule.dispatch;

import com.aiwriter.schedule.core.codec.ScheduledContentParser;
import com.aiwriter.schedule.core.error.DispatchException;
import com.aiwriter.schedule.core.error.MalformedEventException;
import com.aiwriter.schedule.core.model.DispatchPayload;
import com.aiwriter.schedule.core.port.DistributionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * DispatchEntryPoint
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Receives the payload of a fired job and hands the post to distribution.
 *
 *   [ Scheduler ] ── fires ──▶ [ DispatchEntryPoint ] ──▶ [ DistributionService ]
 *
 * The payload is validated with the same rules as every other stage. Any
 * failure surfaces as {@link DispatchException}; the job has already been
 * deleted, so nothing re-fires it.
 */
public class DispatchEntryPoint {

    private static final Logger log = LoggerFactory.getLogger(DispatchEntryPoint.class);

    private final ScheduledContentParser parser;
    private final DistributionService distribution;

    public DispatchEntryPoint(ScheduledContentParser parser, DistributionService distribution) {
        this.parser = parser;
        this.distribution = distribution;
    }

    public Mono<Void> handle(byte[] payload) {
        return Mono.defer(() -> {
            DispatchPayload parsed;
            try {
                parsed = parser.parsePayload(payload);
            } catch (MalformedEventException e) {
                return Mono.error(new DispatchException("invalid dispatch payload: " + e.getMessage(), e));
            }

            String recordId = parsed.scheduledContent().id();
            log.info("Scheduled post due recordId={} userId={} context={}",
                    recordId, parsed.scheduledContent().userId(), parsed.context());

            return distribution.distribute(parsed)
                    .onErrorMap(err -> !(err instanceof DispatchException),
                            err -> new DispatchException("distribution failed recordId=" + recordId, err));
        });
    }
}
