package com.aiwriter.schedule.core.codec;

import com.aiwriter.schedule.core.error.MalformedEventException;
import com.aiwriter.schedule.core.model.DispatchPayload;
import com.aiwriter.schedule.core.model.DomainEvent;
import com.aiwriter.schedule.core.model.LocalSchedule;
import com.aiwriter.schedule.core.model.ScheduledContentRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;

/**
 * =====================================================================
 * ScheduledContentParser
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The one validating parse step between untyped JSON and the pipeline's
 * typed records. Used for change feed row images, bus envelopes and
 * dispatch payloads so every stage applies the same rules.
 *
 * ACCEPTED SHAPES
 * ---------------
 * Plain JSON values:
 *
 *   {"id": "abc123", "schedule": {"year": 2025, ...}}
 *
 * or typed attribute maps as emitted by the record store's change stream:
 *
 *   {"id": {"S": "abc123"}, "schedule": {"M": {"year": {"N": "2025"}, ...}}}
 *
 * Both may be mixed. Typed maps are unwrapped first, then the fields are
 * validated.
 *
 * FAILURES
 * --------
 * Missing or ill-typed fields and impossible calendar dates raise
 * {@link MalformedEventException} naming the offending field.
 */
public class ScheduledContentParser {

    private final ObjectMapper mapper;

    public ScheduledContentParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ScheduledContentRecord parseRecord(JsonNode image) {
        JsonNode node = unwrap(image);
        if (node == null || !node.isObject()) {
            throw new MalformedEventException("scheduledContent: expected an object");
        }

        String id = requireText(node, "id");
        String userId = requireText(node, "userId");
        String draftId = optionalText(node, "draftId");
        String articleId = optionalText(node, "articleId");
        String entity = requireText(node, "entity");
        LocalSchedule schedule = parseSchedule(node.get("schedule"));
        Long createdOn = optionalLong(node, "createdOn");

        return new ScheduledContentRecord(id, userId, draftId, articleId, entity, schedule, createdOn);
    }

    public DomainEvent parseEvent(byte[] body) {
        JsonNode root = readTree(body, "event");
        String source = requireText(root, "source");
        String detailType = requireText(root, "detailType");
        JsonNode detail = root.get("detail");
        if (detail == null || !detail.isObject()) {
            throw new MalformedEventException("detail: expected an object");
        }
        JsonNode content = detail.get("scheduledContent");
        if (content == null || content.isNull()) {
            throw new MalformedEventException("detail.scheduledContent: missing");
        }
        return new DomainEvent(source, detailType, new DomainEvent.Detail(parseRecord(content)));
    }

    public DispatchPayload parsePayload(byte[] body) {
        JsonNode root = readTree(body, "payload");
        JsonNode content = root.get("scheduledContent");
        if (content == null || content.isNull()) {
            throw new MalformedEventException("scheduledContent: missing");
        }
        return new DispatchPayload(parseRecord(content), requireText(root, "context"));
    }

    private JsonNode readTree(byte[] body, String what) {
        if (body == null || body.length == 0) {
            throw new MalformedEventException(what + ": empty body");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new MalformedEventException(what + ": not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException(what + ": expected a JSON object");
        }
        return root;
    }

    private static LocalSchedule parseSchedule(JsonNode raw) {
        JsonNode node = unwrap(raw);
        if (node == null || !node.isObject()) {
            throw new MalformedEventException("schedule: expected an object");
        }
        int year = requireInt(node, "year");
        int month = requireInt(node, "month");
        int day = requireInt(node, "day");
        int hour = requireInt(node, "hour");
        int minute = requireInt(node, "minute");
        int second = requireInt(node, "second");
        try {
            return new LocalSchedule(year, month, day, hour, minute, second);
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException("schedule: " + e.getMessage(), e);
        }
    }

    /**
     * Strips typed attribute wrappers: S, N, BOOL, NULL and M (recursively).
     * Plain values pass through unchanged.
     */
    static JsonNode unwrap(JsonNode node) {
        if (node == null || !node.isObject() || node.size() != 1) {
            return node;
        }
        Map.Entry<String, JsonNode> only = node.fields().next();
        JsonNode value = only.getValue();
        switch (only.getKey()) {
            case "S":
                return value.isTextual() ? value : node;
            case "N":
                if (!value.isTextual()) {
                    return node;
                }
                try {
                    return JsonNodeFactory.instance.numberNode(new BigDecimal(value.asText()));
                } catch (NumberFormatException e) {
                    throw new MalformedEventException("not a number: " + value.asText(), e);
                }
            case "BOOL":
                return value.isBoolean() ? value : node;
            case "NULL":
                return JsonNodeFactory.instance.nullNode();
            case "M":
                if (!value.isObject()) {
                    return node;
                }
                ObjectNode out = JsonNodeFactory.instance.objectNode();
                Iterator<Map.Entry<String, JsonNode>> it = value.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    out.set(e.getKey(), unwrap(e.getValue()));
                }
                return out;
            default:
                return node;
        }
    }

    private static String requireText(JsonNode parent, String field) {
        JsonNode v = unwrap(parent.get(field));
        if (v == null || v.isNull()) {
            throw new MalformedEventException(field + ": missing");
        }
        if (!v.isTextual() || v.asText().isBlank()) {
            throw new MalformedEventException(field + ": expected a non-blank string");
        }
        return v.asText();
    }

    private static String optionalText(JsonNode parent, String field) {
        JsonNode v = unwrap(parent.get(field));
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.isTextual()) {
            throw new MalformedEventException(field + ": expected a string");
        }
        return v.asText();
    }

    private static int requireInt(JsonNode parent, String field) {
        JsonNode v = unwrap(parent.get(field));
        if (v == null || v.isNull()) {
            throw new MalformedEventException("schedule." + field + ": missing");
        }
        if (!v.isIntegralNumber() && !(v.isNumber() && isWhole(v.decimalValue()))) {
            throw new MalformedEventException("schedule." + field + ": expected an integer");
        }
        if (!v.canConvertToInt()) {
            throw new MalformedEventException("schedule." + field + ": out of range");
        }
        return v.intValue();
    }

    private static Long optionalLong(JsonNode parent, String field) {
        JsonNode v = unwrap(parent.get(field));
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.isNumber() || !v.canConvertToLong()) {
            throw new MalformedEventException(field + ": expected epoch millis");
        }
        return v.longValue();
    }

    private static boolean isWhole(BigDecimal value) {
        return value.signum() == 0 || value.scale() <= 0 || value.stripTrailingZeros().scale() <= 0;
    }
}
