package com.aiwriter.schedule.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * =====================================================================
 * ChangeFeedEntry
 * =====================================================================
 *
 * PURPOSE
 * -------
 * One mutation of the record store as seen on the change feed.
 *
 * {@link #rowImage} is the post-change image of the row. It is kept as a raw
 * JSON tree because the store may emit either plain JSON values or typed
 * attribute maps ({@code {"S": "..."}}, {@code {"N": "..."}}, {@code {"M": {...}}});
 * decoding into a {@link ScheduledContentRecord} is the parser's job.
 *
 * {@link #entityType} mirrors the row's entity tag so the feed can be filtered
 * without decoding the image. The filter still checks the image itself.
 */
public record ChangeFeedEntry(String changeId, ChangeKind eventKind, String entityType, JsonNode rowImage) {
}
