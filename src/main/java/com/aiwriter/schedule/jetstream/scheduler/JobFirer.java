package com.aiwriter.schedule.jetstream.scheduler;

import com.aiwriter.schedule.core.port.EventBusPublisher;
import com.aiwriter.schedule.jetstream.bootstrap.JetStreamBootstrapCompleteEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.KeyValue;
import io.nats.client.api.KeyValueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires due jobs from the job bucket.
 *
 * <p>Every {@code fireInterval} the bucket is scanned. For each job whose fire time has passed:</p>
 * <ol>
 *   <li>its payload is published to its target subject with message id = job name;</li>
 *   <li>the key is deleted.</li>
 * </ol>
 * If the process dies between the two steps the job fires again on the next scan; the
 * dispatch stream drops the repeated publish because the message id is the same.
 *
 * <p>Several instances may fire concurrently for the same reason.</p>
 */
public class JobFirer implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(JobFirer.class);

    private final KeyValue jobs;
    private final EventBusPublisher publisher;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration fireInterval;

    private final AtomicReference<Disposable> running = new AtomicReference<>();

    public JobFirer(KeyValue jobs, EventBusPublisher publisher, ObjectMapper mapper, Clock clock, Duration fireInterval) {
        this.jobs = jobs;
        this.publisher = publisher;
        this.mapper = mapper;
        this.clock = clock;
        this.fireInterval = fireInterval;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        startIfNotStarted();
    }

    @EventListener(JetStreamBootstrapCompleteEvent.class)
    public void onBootstrapComplete() {
        startIfNotStarted();
    }

    private void startIfNotStarted() {
        if (running.get() != null) {
            return;
        }
        Disposable d = Flux.interval(fireInterval)
                .onBackpressureDrop()
                .concatMap(tick -> fireDue()
                        .onErrorResume(err -> {
                            log.warn("Job scan failed; will retry next tick err={}", err.toString());
                            return Mono.just(0);
                        }))
                .subscribe(
                        fired -> { },
                        err -> log.error("Job firer terminated unexpectedly: {}", err.toString(), err)
                );
        if (!running.compareAndSet(null, d)) {
            d.dispose();
        }
        log.info("Job firer started interval={}", fireInterval);
    }

    /**
     * Scans the bucket once and fires every due job.
     *
     * @return number of jobs fired
     */
    public Mono<Integer> fireDue() {
        return Mono.fromCallable(jobs::keys)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable)
                .concatMap(this::fireIfDue)
                .count()
                .map(Long::intValue);
    }

    private Mono<String> fireIfDue(String key) {
        return Mono.fromCallable(() -> load(key))
                .subscribeOn(Schedulers.boundedElastic())
                .filter(job -> job.isDue(clock.instant()))
                .flatMap(job -> publisher.publish(job.targetRef(), job.name(), job.payload())
                        .then(Mono.fromCallable(() -> delete(key)).subscribeOn(Schedulers.boundedElastic()))
                        .doOnSuccess(k -> log.info("Fired job name={} target={} fireAt={}",
                                job.name(), job.targetRef(), job.fireAt())))
                .onErrorResume(err -> {
                    log.warn("Firing failed; job stays pending key={} err={}", key, err.toString());
                    return Mono.empty();
                });
    }

    /**
     * @return the stored job, or empty when the key was removed meanwhile
     */
    private StoredJob load(String key) throws Exception {
        KeyValueEntry entry = jobs.get(key);
        if (entry == null || entry.getValue() == null) {
            return null;
        }
        try {
            return mapper.readValue(entry.getValue(), StoredJob.class);
        } catch (IOException e) {
            log.error("Unreadable job removed from bucket key={} err={}", key, e.getMessage());
            jobs.delete(key);
            return null;
        }
    }

    private String delete(String key) throws Exception {
        jobs.delete(key);
        return key;
    }

    @Override
    public void destroy() {
        Disposable d = running.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
