package com.aiwriter.schedule.jetstream.consumer;

import com.aiwriter.schedule.jetstream.bootstrap.JetStreamBootstrapCompleteEvent;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.ReplayPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base of every pull consumer in the pipeline:
 * <ul>
 *   <li>Uses a <b>durable</b> consumer name derived from node identity.</li>
 *   <li>Uses <b>explicit ACK</b>; each message is settled with the {@link AckDecision} its handler returns.</li>
 *   <li>Uses <b>pull-based consumption</b> to control backpressure.</li>
 *   <li>Starts only after the application is ready, and retries until the stream exists.</li>
 * </ul>
 *
 * <h2>Operational behavior</h2>
 * <ul>
 *   <li>Never crashes the Spring context if JetStream resources are not ready.</li>
 *   <li>Messages are handled one at a time, in delivery order.</li>
 *   <li>A handler error that escapes {@link #handle(Message)} is logged and the message NAKed.</li>
 *   <li>Cleans up on shutdown.</li>
 * </ul>
 *
 * Subclasses are Spring components; they pass their stream settings to the constructor and
 * implement {@link #handle(Message)}.
 */
public abstract class AbstractPullConsumer implements DisposableBean {

    private final Logger log = LoggerFactory.getLogger(getClass());

    /**
     * JetStream API error code for "stream not found".
     * Recoverable during startup / provisioning windows.
     */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private static final Duration SUBSCRIBE_RETRY_INTERVAL = Duration.ofSeconds(2);

    /**
     * Max wait of each nextMessage() poll. Short polls keep shutdown responsive.
     */
    private static final Duration NEXT_MESSAGE_POLL = Duration.ofMillis(250);

    private final JetStream js;
    private final String stream;
    private final String filterSubject;
    private final String durable;
    private final Duration pollInterval;
    private final int batchSize;
    private final Duration nakDelay;

    private final AtomicReference<Disposable> running = new AtomicReference<>();

    protected AbstractPullConsumer(
            JetStream js,
            String stream,
            String filterSubject,
            String durable,
            Duration pollInterval,
            int batchSize,
            Duration nakDelay
    ) {
        this.js = js;
        this.stream = stream;
        this.filterSubject = filterSubject;
        this.durable = durable;
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
        this.nakDelay = nakDelay;
    }

    /**
     * Handles one message and decides how it is settled.
     *
     * <p>Runs on a bounded-elastic thread; blocking is allowed.</p>
     */
    protected abstract Mono<AckDecision> handle(Message msg);

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        startIfNotStarted();
    }

    @EventListener(JetStreamBootstrapCompleteEvent.class)
    public void onBootstrapComplete() {
        startIfNotStarted();
    }

    public String durableName() {
        return durable;
    }

    private void startIfNotStarted() {
        if (running.get() != null) {
            return;
        }

        // DeliverPolicy.All: a newly created durable starts from the oldest retained message.
        final ConsumerConfiguration consumerConfig = ConsumerConfiguration.builder()
                .durable(durable)
                .deliverPolicy(DeliverPolicy.All)
                .replayPolicy(ReplayPolicy.Instant)
                .ackPolicy(AckPolicy.Explicit)
                .filterSubject(filterSubject)
                .build();

        final PullSubscribeOptions pso = PullSubscribeOptions.builder()
                .stream(stream)
                .configuration(consumerConfig)
                .build();

        Disposable d = Flux.interval(Duration.ZERO, SUBSCRIBE_RETRY_INTERVAL)
                .publishOn(Schedulers.boundedElastic())
                .concatMap(tick -> subscribeAndConsumeOnce(pso)
                        .onErrorResume(err -> {
                            log.warn("Consumer loop ended with error. Will retry subscription. stream={} durable={} err={}",
                                    stream, durable, err.toString());
                            return Mono.empty();
                        }))
                .subscribe(
                        v -> { },
                        err -> log.error("Consumer supervisor terminated unexpectedly: {}", err.toString(), err)
                );

        if (!running.compareAndSet(null, d)) {
            d.dispose();
        }
    }

    /**
     * Subscribes, then runs the pull loop. Completes only when the subscription ends,
     * or immediately when the stream does not exist yet.
     */
    private Mono<Void> subscribeAndConsumeOnce(PullSubscribeOptions pso) {
        return Mono.fromCallable(() -> {
                    try {
                        JetStreamSubscription sub = js.subscribe(filterSubject, pso);
                        log.info("Subscribed: stream={} filter={} durable={}", stream, filterSubject, durable);
                        return sub;
                    } catch (JetStreamApiException jse) {
                        if (jse.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR) {
                            log.warn("Waiting for stream to exist: stream={}. Will retry...", stream);
                            return null;
                        }
                        throw jse;
                    }
                })
                .flatMap(sub -> consumePullLoop(sub)
                        .doFinally(sig -> {
                            try {
                                sub.unsubscribe();
                            } catch (Exception e) {
                                log.debug("Unsubscribe failed (ignored): {}", e.toString());
                            }
                        }));
    }

    private Mono<Void> consumePullLoop(JetStreamSubscription sub) {
        return Flux.interval(pollInterval)
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(t -> sub.pull(batchSize))
                .concatMap(t -> Flux.<Message>generate(sink -> {
                    try {
                        Message m = sub.nextMessage(NEXT_MESSAGE_POLL);
                        if (m == null) {
                            sink.complete();
                        } else {
                            sink.next(m);
                        }
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        sink.complete();
                    } catch (Exception e) {
                        sink.error(e);
                    }
                }))
                .concatMap(this::process)
                .then();
    }

    /**
     * Runs the handler and settles the message. Never errors.
     */
    Mono<Void> process(Message msg) {
        return Mono.defer(() -> handle(msg))
                .defaultIfEmpty(AckDecision.ACK)
                .onErrorResume(err -> {
                    log.warn("Message handling failed; message will be redelivered. subject={} err={}",
                            msg.getSubject(), err.toString(), err);
                    return Mono.just(AckDecision.NAK);
                })
                .doOnNext(decision -> settle(msg, decision))
                .onErrorResume(err -> {
                    log.warn("Settling message failed subject={} err={}", msg.getSubject(), err.toString());
                    return Mono.empty();
                })
                .then();
    }

    private void settle(Message msg, AckDecision decision) {
        switch (decision) {
            case ACK -> msg.ack();
            case NAK -> msg.nak();
            case NAK_WITH_DELAY -> msg.nakWithDelay(nakDelay);
            case TERM -> msg.term();
        }
    }

    @Override
    public void destroy() {
        Disposable d = running.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }
}
