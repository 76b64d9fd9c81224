package com.aiwriter.schedule.capture;

import com.aiwriter.schedule.core.codec.ScheduledContentParser;
import com.aiwriter.schedule.core.error.MalformedEventException;
import com.aiwriter.schedule.core.model.ChangeFeedEntry;
import com.aiwriter.schedule.core.model.ChangeKind;
import com.aiwriter.schedule.core.model.DomainEvent;
import com.aiwriter.schedule.core.model.ScheduledContentRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Selects newly inserted scheduled content from the change feed and reshapes it into a
 * {@code ScheduleContentCreated} event.
 *
 * <p>An entry passes only when it is an {@link ChangeKind#INSERT} and the row image's own
 * entity tag is {@link ScheduledContentRecord#ENTITY_TAG}. Modifications, removals and other
 * entities yield {@link Optional#empty()}; they are not errors.</p>
 *
 * <p>Pure apart from logging.</p>
 */
public class ChangeCaptureFilter {

    private static final Logger log = LoggerFactory.getLogger(ChangeCaptureFilter.class);

    private final ScheduledContentParser parser;

    public ChangeCaptureFilter(ScheduledContentParser parser) {
        this.parser = parser;
    }

    /**
     * @throws MalformedEventException if the entry qualifies but its row image does not parse
     */
    public Optional<DomainEvent> filter(ChangeFeedEntry entry) {
        if (entry == null || entry.eventKind() != ChangeKind.INSERT) {
            return Optional.empty();
        }
        JsonNode image = entry.rowImage();
        if (image == null || image.isNull()) {
            throw new MalformedEventException("change " + entry.changeId() + ": INSERT without row image");
        }
        if (!ScheduledContentRecord.ENTITY_TAG.equals(entityOf(image))) {
            return Optional.empty();
        }

        ScheduledContentRecord record = parser.parseRecord(image);
        if (record.draftId() != null && record.articleId() != null) {
            log.warn("Scheduled content carries both draftId and articleId recordId={} draftId={} articleId={}",
                    record.id(), record.draftId(), record.articleId());
        }
        return Optional.of(DomainEvent.scheduleContentCreated(record));
    }

    /**
     * Entity tag of the image, plain or typed ({@code {"S": ...}}).
     */
    private static String entityOf(JsonNode image) {
        JsonNode entity = image.get("entity");
        if (entity == null) {
            return null;
        }
        if (entity.isTextual()) {
            return entity.asText();
        }
        JsonNode typed = entity.get("S");
        return typed != null && typed.isTextual() ? typed.asText() : null;
    }
}
