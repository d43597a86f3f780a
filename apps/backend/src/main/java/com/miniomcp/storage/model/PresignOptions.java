package com.miniomcp.storage.model;

import java.time.ZonedDateTime;
import java.util.Map;

/**
 * @param expires       validity in seconds; null or non-positive means the configured default
 * @param requestParams extra query parameters signed into GET and DELETE URLs
 * @param requestDate   anchor of the validity window, the URL expires at requestDate + expires
 */
public record PresignOptions(Integer expires, Map<String, String> requestParams, ZonedDateTime requestDate) {

    public static PresignOptions defaults() {
        return new PresignOptions(null, null, null);
    }
}
