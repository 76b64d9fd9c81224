package com.aiwriter.schedule.jetstream.bootstrap;

import com.aiwriter.schedule.jetstream.config.JetStreamBootstrapProperties;
import com.aiwriter.schedule.jetstream.config.JetStreamStreamsProperties;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.KeyValueManagement;
import io.nats.client.api.KeyValueConfiguration;
import io.nats.client.api.KeyValueStatus;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * =====================================================================
 * JetStreamBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Ensures the pipeline's JetStream streams (CHANGE_FEED,
 * SCHEDULED_CONTENT_EVENTS and CONTENT_DISPATCH) exist and conform to
 * their configuration.
 *
 * The job key-value bucket is provisioned earlier, while the context is
 * still being built: the client library binds to a bucket only once it
 * exists. See {@link #ensureJobBucket(KeyValueManagement, String, String)}.
 *
 * WHEN THIS RUNS
 * --------------
 * - Once during Spring Boot startup, after the connection is established
 * - Before consumers subscribe (they wait for the completion event)
 *
 * DRIFT
 * -----
 * Existing streams are never modified. A mismatch either fails startup or
 * logs a warning, depending on {@link JetStreamBootstrapProperties}.
 */
@Component
@ConditionalOnProperty(
        prefix = "contentsched.bootstrap",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class JetStreamBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(JetStreamBootstrapper.class);

    /**
     * JetStream API error code indicating "stream not found".
     * A key-value bucket is a stream, so the same code applies to buckets.
     */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStreamManagement jsm;
    private final JetStreamStreamsProperties streamsProps;
    private final JetStreamBootstrapProperties bootstrapProps;
    private final ApplicationEventPublisher publisher;

    public JetStreamBootstrapper(
            JetStreamManagement jsm,
            JetStreamStreamsProperties streamsProps,
            JetStreamBootstrapProperties bootstrapProps,
            ApplicationEventPublisher publisher
    ) {
        this.jsm = jsm;
        this.streamsProps = streamsProps;
        this.bootstrapProps = bootstrapProps;
        this.publisher = publisher;
    }

    /**
     * FLOW
     * ----
     * 1. Ensure every selected stream exists and matches config
     * 2. Publish {@link JetStreamBootstrapCompleteEvent}
     */
    @Override
    public void run(ApplicationArguments args) throws Exception {
        var selected = streamsProps.selectByKeys(bootstrapProps.getStreamKeys());
        log.info("JetStream bootstrap: streamKeys={} (bootstrapping {} streams)",
                bootstrapProps.getStreamKeys().isEmpty() ? "all" : bootstrapProps.getStreamKeys(), selected.size());

        for (JetStreamStreamsProperties.StreamSpec spec : selected) {
            ensureStream(spec);
        }

        publisher.publishEvent(new JetStreamBootstrapCompleteEvent());
        log.info("JetStream bootstrap complete (published JetStreamBootstrapCompleteEvent)");
    }

    private void ensureStream(JetStreamStreamsProperties.StreamSpec spec) throws Exception {
        StreamConfiguration desired = toStreamConfig(spec);

        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            validateExisting(desired, existing);
            return;
        } catch (JetStreamApiException e) {
            // Only create when the stream truly does not exist; permission and
            // infrastructure failures propagate.
            if (!isStreamNotFound(e)) {
                throw e;
            }
        }

        jsm.addStream(desired);

        log.info("Created JetStream stream: {} (subjects={}, maxAge={}, retention={}, storage={}, replicas={}, duplicateWindow={})",
                desired.getName(),
                desired.getSubjects(),
                desired.getMaxAge(),
                desired.getRetentionPolicy(),
                desired.getStorageType(),
                desired.getReplicas(),
                desired.getDuplicateWindow());
    }

    /**
     * Creates the bucket when it does not exist. An existing bucket is left as is.
     */
    public static void ensureJobBucket(KeyValueManagement kvm, String bucket, String storage) throws Exception {
        try {
            KeyValueStatus status = kvm.getStatus(bucket);
            log.info("Job bucket exists: {} (storage={}, values={})",
                    bucket, status.getStorageType(), status.getEntryCount());
            return;
        } catch (JetStreamApiException e) {
            if (!isStreamNotFound(e)) {
                throw e;
            }
        }

        KeyValueConfiguration config = KeyValueConfiguration.builder()
                .name(bucket)
                .storageType(parseStorageType(storage))
                .maxHistoryPerKey(1)
                .build();
        kvm.create(config);
        log.info("Created job bucket: {} (storage={})", bucket, config.getStorageType());
    }

    /**
     * Differences are reported, never repaired.
     */
    private void validateExisting(StreamConfiguration desired, StreamInfo existing) {
        StreamConfiguration actual = existing.getConfiguration();
        List<String> diffs = new ArrayList<>();

        if (!Objects.equals(actual.getRetentionPolicy(), desired.getRetentionPolicy())) {
            diffs.add("retentionPolicy actual=" + actual.getRetentionPolicy()
                    + " expected=" + desired.getRetentionPolicy());
        }
        if (!Objects.equals(actual.getStorageType(), desired.getStorageType())) {
            diffs.add("storageType actual=" + actual.getStorageType()
                    + " expected=" + desired.getStorageType());
        }
        if (!Objects.equals(actual.getMaxAge(), desired.getMaxAge())) {
            diffs.add("maxAge actual=" + actual.getMaxAge()
                    + " expected=" + desired.getMaxAge());
        }
        if (actual.getReplicas() != desired.getReplicas()) {
            diffs.add("replicas actual=" + actual.getReplicas()
                    + " expected=" + desired.getReplicas());
        }
        if (!Objects.equals(actual.getDuplicateWindow(), desired.getDuplicateWindow())) {
            diffs.add("duplicateWindow actual=" + actual.getDuplicateWindow()
                    + " expected=" + desired.getDuplicateWindow());
        }
        if (!setEquals(actual.getSubjects(), desired.getSubjects())) {
            diffs.add("subjects actual=" + actual.getSubjects()
                    + " expected=" + desired.getSubjects());
        }

        if (diffs.isEmpty()) {
            log.info("JetStream stream exists and matches config: {} (subjects={})",
                    desired.getName(), actual.getSubjects());
            return;
        }

        String msg = "JetStream stream exists but differs from expected: "
                + desired.getName() + " :: " + String.join("; ", diffs);

        if (bootstrapProps.isFailOnMismatch()) {
            throw new IllegalStateException(msg);
        }
        log.warn(msg);
    }

    private static boolean isStreamNotFound(JetStreamApiException e) {
        return e.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR;
    }

    private static boolean setEquals(List<String> a, List<String> b) {
        Set<String> sa = new HashSet<>(a == null ? List.of() : a);
        Set<String> sb = new HashSet<>(b == null ? List.of() : b);
        return sa.equals(sb);
    }

    /**
     * Converts declarative StreamSpec → JetStream StreamConfiguration.
     */
    static StreamConfiguration toStreamConfig(JetStreamStreamsProperties.StreamSpec spec) {
        String name = spec.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }

        List<String> subjects = spec.getSubjects();
        if (subjects == null || subjects.isEmpty()) {
            throw new IllegalArgumentException("subjects is required for stream " + name);
        }

        Duration maxAge = Objects.requireNonNull(spec.getMaxAge(), "maxAge is required for stream " + name);

        StreamConfiguration.Builder b = StreamConfiguration.builder()
                .name(name)
                .subjects(subjects.toArray(String[]::new))
                .retentionPolicy(parseRetentionPolicy(spec.getRetentionPolicy()))
                .storageType(parseStorageType(spec.getStorageType()))
                .maxAge(maxAge)
                .replicas(spec.getReplicas());

        if (spec.getDuplicateWindow() != null) {
            b.duplicateWindow(spec.getDuplicateWindow());
        }
        return b.build();
    }

    /**
     * Default: WorkQueue.
     */
    static RetentionPolicy parseRetentionPolicy(String value) {
        if (value == null || value.isBlank()) {
            return RetentionPolicy.WorkQueue;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "workqueue", "work_queue", "work-queue" -> RetentionPolicy.WorkQueue;
            case "limits" -> RetentionPolicy.Limits;
            case "interest" -> RetentionPolicy.Interest;
            default -> throw new IllegalArgumentException("Unsupported retentionPolicy: " + value);
        };
    }

    /**
     * Default: File.
     */
    static StorageType parseStorageType(String value) {
        if (value == null || value.isBlank()) {
            return StorageType.File;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new IllegalArgumentException("Unsupported storageType: " + value);
        };
    }
}
