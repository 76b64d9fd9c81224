package com.aiwriter.schedule.store.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ScheduledContentRequest(
        @NotBlank String userId,
        String draftId,
        String articleId,
        @NotNull @Valid Schedule schedule
) {

    /**
     * Naive local wall-clock time. Range checks only; calendar validity is checked on creation.
     */
    public record Schedule(
            @Min(1970) @Max(9999) int year,
            @Min(1) @Max(12) int month,
            @Min(1) @Max(31) int day,
            @Min(0) @Max(23) int hour,
            @Min(0) @Max(59) int minute,
            @Min(0) @Max(59) int second
    ) {}
}
