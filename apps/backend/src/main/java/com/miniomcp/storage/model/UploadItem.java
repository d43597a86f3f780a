package com.miniomcp.storage.model;

import java.util.Map;

/**
 * @param source local path or http(s) URL
 */
public record UploadItem(String source, String objectName, Map<String, String> metadata) {}
