package com.example.campaign.shared.util;

import com.example.campaign.shared.model.SegmentFilter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * JSON helpers for the segment filter column of the campaigns table.
 */
@Slf4j
public final class JsonUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonUtils() {}

    /**
     * Parses the stored segment filter array. A null or blank column means "no filters".
     * Unreadable JSON is an error: treating it as empty would widen the audience to everyone.
     */
    public static List<SegmentFilter> parseSegments(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<SegmentFilter>>() {});
        } catch (JsonProcessingException e) {
            log.error("Failed to parse segment filters: {}", json, e);
            throw new IllegalStateException("Stored segment filters are not valid JSON", e);
        }
    }

    public static String toJson(List<SegmentFilter> segments) {
        if (segments == null || segments.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(segments);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize segment filters", e);
        }
    }
}
