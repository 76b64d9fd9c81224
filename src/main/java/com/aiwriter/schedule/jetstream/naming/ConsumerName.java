package com.aiwriter.schedule.jetstream.naming;

/**
 * Builds durable consumer names using a strict, deterministic convention.
 *
 * <h2>Purpose</h2>
 * JetStream durable consumers are identified by name. A stable name means a restarted
 * instance resumes the same consumer (and its acknowledged position) instead of creating
 * a new one that would replay the stream.
 *
 * <h2>Format (LOCKED)</h2>
 * <pre>
 * &lt;service&gt;_&lt;role&gt;_&lt;node&gt;
 * </pre>
 *
 * <p><b>Examples</b></p>
 * <pre>
 * content-scheduler_changefeed_node01
 * content-scheduler_eventbus_node01
 * content-scheduler_dispatch_node01
 * </pre>
 *
 * <h2>Constraints</h2>
 * <ul>
 *   <li>JetStream names may not contain whitespace, {@code .}, {@code *} or {@code >}; offending
 *       characters are replaced by {@code -}.</li>
 *   <li>Keep the format stable: changing it orphans existing consumers.</li>
 * </ul>
 */
public final class ConsumerName {

    private ConsumerName() {}

    /**
     * @param service logical service name (e.g. "content-scheduler")
     * @param role what the consumer does (e.g. "changefeed", "eventbus", "dispatch")
     * @param node unique node id (e.g. "node01")
     * @return deterministic durable consumer name
     */
    public static String of(String service, String role, String node) {
        return sanitize(service) + "_" + sanitize(role) + "_" + sanitize(node);
    }

    private static String sanitize(String part) {
        if (part == null || part.isBlank()) {
            throw new IllegalArgumentException("consumer name part must not be blank");
        }
        return part.trim().replaceAll("[\\s.*>]", "-");
    }
}
