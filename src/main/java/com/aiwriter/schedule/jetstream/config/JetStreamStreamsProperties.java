package com.aiwriter.schedule.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JetStream stream configuration bound from Spring Boot configuration properties.
 *
 * <p><b>Purpose</b></p>
 * <ul>
 *   <li>Centralizes stream definitions (names, subjects, retention, storage, replicas, de-dup window).</li>
 *   <li>Provides safe defaults so a deployment can start with zero configuration.</li>
 *   <li>Allows operators to override any stream property via application configuration.</li>
 * </ul>
 *
 * <p><b>Pipeline streams</b></p>
 * <ul>
 *   <li><b>change-feed</b>: mutations of the record store, in commit order.</li>
 *   <li><b>events</b>: the internal event bus carrying {@code DomainEvent} envelopes.</li>
 *   <li><b>dispatch</b>: payloads of fired jobs on their way to the dispatch entry point.</li>
 * </ul>
 * All three use {@code WorkQueue} retention: each message is processed by exactly one durable
 * consumer and removed once acknowledged.
 *
 * <p>
 * Configuration prefix: {@code contentsched.jetstream}
 * </p>
 */
@ConfigurationProperties(prefix = "contentsched.jetstream")
public class JetStreamStreamsProperties {

    private Streams streams = new Streams();

    public Streams getStreams() {
        return streams;
    }

    public void setStreams(Streams streams) {
        this.streams = streams;
    }

    /**
     * Returns all configured and enabled stream specifications, in pipeline order.
     */
    public List<StreamSpec> all() {
        List<StreamSpec> out = new ArrayList<>();
        for (StreamSpec spec : byKey().values()) {
            if (spec != null && spec.isEnabled()) {
                out.add(spec);
            }
        }
        return out;
    }

    /**
     * Returns a stable map of logical stream keys to configured stream specs.
     *
     * <p>Keys match the YAML object keys under {@code contentsched.jetstream.streams}.</p>
     */
    public Map<String, StreamSpec> byKey() {
        Map<String, StreamSpec> out = new LinkedHashMap<>();
        if (streams == null) {
            return out;
        }
        out.put("change-feed", streams.getChangeFeed());
        out.put("events", streams.getEvents());
        out.put("dispatch", streams.getDispatch());
        return out;
    }

    /**
     * Select a subset of streams by logical keys.
     */
    public List<StreamSpec> selectByKeys(List<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return all();
        }
        Map<String, StreamSpec> map = byKey();
        List<StreamSpec> out = new ArrayList<>();
        for (String rawKey : keys) {
            if (rawKey == null || rawKey.isBlank()) {
                continue;
            }
            String key = rawKey.trim().toLowerCase(Locale.ROOT);
            StreamSpec spec = map.get(key);
            if (spec == null) {
                throw new IllegalArgumentException("Unknown stream key: " + rawKey + ". Valid keys=" + map.keySet());
            }
            if (!spec.isEnabled()) {
                throw new IllegalStateException("Stream key '" + key + "' is configured but disabled (enabled=false)");
            }
            out.add(spec);
        }
        return out;
    }

    /**
     * Grouping of all stream specs that this service bootstraps.
     */
    public static class Streams {
        private StreamSpec changeFeed = StreamSpec.defaultsChangeFeed();
        private StreamSpec events = StreamSpec.defaultsEvents();
        private StreamSpec dispatch = StreamSpec.defaultsDispatch();

        public StreamSpec getChangeFeed() { return changeFeed; }
        public void setChangeFeed(StreamSpec changeFeed) { this.changeFeed = changeFeed; }

        public StreamSpec getEvents() { return events; }
        public void setEvents(StreamSpec events) { this.events = events; }

        public StreamSpec getDispatch() { return dispatch; }
        public void setDispatch(StreamSpec dispatch) { this.dispatch = dispatch; }
    }

    /**
     * Specification for a single JetStream stream.
     *
     * <p>Retention/storage are represented as Strings to keep property binding simple;
     * the bootstrapper maps them to NATS client enums.</p>
     */
    public static class StreamSpec {

        /** Stream name as registered in JetStream (e.g., {@code CHANGE_FEED}). */
        private String name;

        /** When {@code false}, this spec is ignored by bootstrap logic. */
        private boolean enabled = true;

        /** One or more subject filters that belong to this stream. */
        private List<String> subjects = new ArrayList<>();

        /** Maximum age for messages retained in the stream. */
        private Duration maxAge;

        /** Retention policy ({@code WorkQueue}, {@code Limits} or {@code Interest}). */
        private String retentionPolicy = "WorkQueue";

        /** Storage type ({@code File} or {@code Memory}). */
        private String storageType = "File";

        /** Replication factor in a clustered deployment. */
        private int replicas = 1;

        /**
         * Window in which publishes with the same message id are treated as duplicates.
         *
         * <p>Must cover the longest expected redelivery gap of the producer.</p>
         */
        private Duration duplicateWindow = Duration.ofMinutes(10);

        public static StreamSpec defaultsChangeFeed() {
            StreamSpec s = new StreamSpec();
            s.name = "CHANGE_FEED";
            s.subjects = List.of("changefeed.>");
            s.maxAge = Duration.ofDays(7);
            return s;
        }

        public static StreamSpec defaultsEvents() {
            StreamSpec s = new StreamSpec();
            s.name = "SCHEDULED_CONTENT_EVENTS";
            s.subjects = List.of("events.>");
            s.maxAge = Duration.ofDays(7);
            return s;
        }

        /**
         * Dispatch payloads may wait for a slow distributor, so they are kept longer.
         */
        public static StreamSpec defaultsDispatch() {
            StreamSpec s = new StreamSpec();
            s.name = "CONTENT_DISPATCH";
            s.subjects = List.of("dispatch.>");
            s.maxAge = Duration.ofDays(14);
            return s;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<String> getSubjects() { return subjects; }
        public void setSubjects(List<String> subjects) { this.subjects = subjects; }

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

        public String getRetentionPolicy() { return retentionPolicy; }
        public void setRetentionPolicy(String retentionPolicy) { this.retentionPolicy = retentionPolicy; }

        public String getStorageType() { return storageType; }
        public void setStorageType(String storageType) { this.storageType = storageType; }

        public int getReplicas() { return replicas; }
        public void setReplicas(int replicas) { this.replicas = replicas; }

        public Duration getDuplicateWindow() { return duplicateWindow; }
        public void setDuplicateWindow(Duration duplicateWindow) { this.duplicateWindow = duplicateWindow; }
    }
}
