package com.example.commandservice.handler;

import com.example.commandservice.exception.InvalidPayloadException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.UUID;

/**
 * Typed, read-only view over a command payload.
 *
 * <p>Distinguishes an absent field from an explicit {@code null}: {@link #has(String)} is true
 * for both {@code "x": null} and {@code "x": "..."}, which is what partial updates key on.
 * Typed accessors return {@code null} for absent, null and empty-string values and raise
 * {@link InvalidPayloadException} for anything unparsable.
 */
public final class Payload {

    private final ObjectNode node;

    private Payload(ObjectNode node) {
        this.node = node;
    }

    public static Payload of(ObjectNode node) {
        return new Payload(node != null ? node : JsonNodeFactory.instance.objectNode());
    }

    public static Payload empty() {
        return of(null);
    }

    public ObjectNode asNode() {
        return node.deepCopy();
    }

    public boolean has(String field) {
        return node.has(field);
    }

    /**
     * First of the given field names present in the payload, or {@code null}.
     */
    public String firstPresent(String... fields) {
        for (String field : fields) {
            if (node.has(field)) {
                return field;
            }
        }
        return null;
    }

    public String text(String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isContainerNode()) {
            throw InvalidPayloadException.invalidValue(field, value);
        }
        return value.asText();
    }

    public String text(String field, String defaultValue) {
        String value = text(field);
        return value != null ? value : defaultValue;
    }

    /**
     * Value for a NOT NULL text column on update: explicit null is rejected, empty string is kept.
     */
    public String nonNullText(String field) {
        return nonNull(field, text(field));
    }

    /**
     * Value for a required create field: absent, null or blank is rejected.
     */
    public String requiredText(String field) {
        String value = text(field);
        if (value == null || value.isBlank()) {
            throw InvalidPayloadException.missingField(field);
        }
        return value;
    }

    public Integer integer(String field) {
        JsonNode value = node.get(field);
        if (isBlank(value)) {
            return null;
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.valueOf(value.asText().trim());
            } catch (NumberFormatException e) {
                throw InvalidPayloadException.invalidValue(field, value.asText());
            }
        }
        throw InvalidPayloadException.invalidValue(field, value);
    }

    public Integer integerInRange(String field, int min, int max) {
        Integer value = integer(field);
        if (value != null && (value < min || value > max)) {
            throw InvalidPayloadException.outOfRange(field, min, max);
        }
        return value;
    }

    public BigDecimal decimal(String field) {
        JsonNode value = node.get(field);
        if (isBlank(value)) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.asText().trim());
            } catch (NumberFormatException e) {
                throw InvalidPayloadException.invalidValue(field, value.asText());
            }
        }
        throw InvalidPayloadException.invalidValue(field, value);
    }

    public Boolean bool(String field) {
        JsonNode value = node.get(field);
        if (isBlank(value)) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if ("true".equalsIgnoreCase(text)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return Boolean.FALSE;
            }
        }
        throw InvalidPayloadException.invalidValue(field, value);
    }

    public boolean bool(String field, boolean defaultValue) {
        Boolean value = bool(field);
        return value != null ? value : defaultValue;
    }

    public UUID uuid(String field) {
        String value = text(field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw InvalidPayloadException.invalidValue(field, value);
        }
    }

    public UUID requiredUuid(String field) {
        UUID value = uuid(field);
        if (value == null) {
            throw InvalidPayloadException.missingField(field);
        }
        return value;
    }

    public LocalDate date(String field) {
        String value = text(field);
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() > 10) {
                return LocalDate.parse(trimmed.substring(0, 10));
            }
            return LocalDate.parse(trimmed);
        } catch (DateTimeException e) {
            throw InvalidPayloadException.invalidValue(field, value);
        }
    }

    /**
     * Parse an ISO-8601 timestamp. Values without an offset are read as local time in
     * {@code zone}; a bare date means the start of that day in {@code zone}.
     */
    public Instant instant(String field, ZoneId zone) {
        String value = text(field);
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay(zone).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(trimmed, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeException e) {
            throw InvalidPayloadException.invalidValue(field, value);
        }
    }

    public Instant requiredInstant(String field, ZoneId zone) {
        Instant value = instant(field, zone);
        if (value == null) {
            throw InvalidPayloadException.missingField(field);
        }
        return value;
    }

    /**
     * Reject an explicit null for a NOT NULL column.
     */
    public <T> T nonNull(String field, T value) {
        if (value == null) {
            throw InvalidPayloadException.nullNotAllowed(field);
        }
        return value;
    }

    private static boolean isBlank(JsonNode value) {
        return value == null || value.isNull() || (value.isTextual() && value.asText().isBlank());
    }
}
