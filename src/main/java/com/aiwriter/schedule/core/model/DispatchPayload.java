package com.aiwriter.schedule.core.model;

/**
 * Payload a scheduled job carries to the dispatch entry point.
 *
 * <p>{@code context} is a fixed tag chosen at registration time (e.g. {@code "24hr"}).</p>
 */
public record DispatchPayload(ScheduledContentRecord scheduledContent, String context) {
}
