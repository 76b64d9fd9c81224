package com.aiwriter.schedule.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Kind of mutation recorded by the change feed.
 *
 * <p>Only {@link #INSERT} is relevant to scheduling. Kinds the feed may add in the
 * future decode to {@link #UNKNOWN} instead of failing the whole entry.</p>
 */
public enum ChangeKind {
    INSERT,
    MODIFY,
    REMOVE,
    UNKNOWN;

    @JsonCreator
    public static ChangeKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "INSERT" -> INSERT;
            case "MODIFY", "UPDATE" -> MODIFY;
            case "REMOVE", "DELETE" -> REMOVE;
            default -> UNKNOWN;
        };
    }
}
