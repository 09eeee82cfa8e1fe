package com.aigreentick.services.otprelay.util;

import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the first usable value among an ordered list of field names.
 * The upstream provider is inconsistent about naming ("to" vs "msisdn",
 * "number" vs "full_number"), so every lookup goes through one ordered list.
 */
@UtilityClass
public class CandidateFields {

    /**
     * First candidate whose value is a non-blank scalar, trimmed.
     * Nested objects and arrays are skipped.
     */
    public Optional<String> firstPresent(Map<String, ?> source, List<String> candidates) {
        if (source == null || source.isEmpty()) {
            return Optional.empty();
        }
        for (String field : candidates) {
            Object value = source.get(field);
            if (value == null || value instanceof Map || value instanceof Collection) {
                continue;
            }
            String text = String.valueOf(value).trim();
            if (!text.isEmpty()) {
                return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    /**
     * Nested object under {@code field}, or an empty map when absent or not an object.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> nestedObject(Map<String, ?> source, String field) {
        if (source == null) {
            return Map.of();
        }
        Object value = source.get(field);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    public String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
