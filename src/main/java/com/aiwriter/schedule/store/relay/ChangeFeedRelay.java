package com.aiwriter.schedule.store.relay;

import com.aiwriter.schedule.config.SchedulingProperties;
import com.aiwriter.schedule.core.model.ChangeFeedEntry;
import com.aiwriter.schedule.core.port.EventBusPublisher;
import com.aiwriter.schedule.store.entity.ChangeLogRow;
import com.aiwriter.schedule.store.r2dbc.ChangeLogStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Polls the change log and publishes pending changes to the change feed, outside of the
 * business transaction.
 *
 * Publishing rule (LOCKED): Msg-Id == change id, relying on JetStream dedup.
 */
@Component
@ConditionalOnProperty(prefix = "contentsched.store", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ChangeFeedRelay implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ChangeFeedRelay.class);

    private final ChangeLogStore store;
    private final EventBusPublisher publisher;
    private final ObjectMapper mapper;
    private final String subject;
    private final int batchSize;
    private final Duration pollInterval;
    private final int maxRetries;

    private Disposable subscription;

    public ChangeFeedRelay(
            ChangeLogStore store,
            EventBusPublisher publisher,
            ObjectMapper mapper,
            SchedulingProperties scheduling,
            @Value("${contentsched.store.relay.batch-size:50}") int batchSize,
            @Value("${contentsched.store.relay.poll-interval:2s}") Duration pollInterval,
            @Value("${contentsched.store.relay.max-retries:5}") int maxRetries
    ) {
        this.store = store;
        this.publisher = publisher;
        this.mapper = mapper;
        this.subject = scheduling.getChangeFeedSubject();
        this.batchSize = batchSize;
        this.pollInterval = pollInterval;
        this.maxRetries = maxRetries;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = Flux.interval(pollInterval)
                .onBackpressureDrop()
                .concatMap(tick -> relayOnce()
                        .onErrorResume(err -> {
                            log.warn("Change feed relay error: {}", err.getMessage(), err);
                            return Mono.empty();
                        }))
                .subscribe();
    }

    /**
     * Publishes one batch of pending changes, oldest first.
     */
    public Mono<Void> relayOnce() {
        return store.findPending(batchSize)
                .concatMap(this::publishOne)
                .then();
    }

    private Mono<Void> publishOne(ChangeLogRow row) {
        return Mono.fromCallable(() -> mapper.writeValueAsBytes(new ChangeFeedEntry(
                        row.id().toString(), row.eventKind(), row.entityType(), mapper.readTree(row.rowImageJson()))))
                .flatMap(body -> publisher.publish(subject, row.id().toString(), body))
                .then(Mono.defer(() -> store.markPublished(row.id())))
                .doOnError(err -> log.warn("Publish failed changeId={} err={}", row.id(), err.toString()))
                .onErrorResume(err -> {
                    int nextRetry = row.retryCount() + 1;
                    // max-retries <= 0: retry forever
                    if (maxRetries <= 0 || nextRetry <= maxRetries) {
                        return store.markPending(row.id(), nextRetry);
                    }
                    return store.markFailed(row.id(), nextRetry);
                });
    }

    @Override
    public synchronized void destroy() {
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
        }
    }
}
