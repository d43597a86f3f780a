package com.miniomcp.storage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.ZonedDateTime;
import java.util.Map;

/**
 * 对象元数据快照。isDir 由对象名是否以 "/" 结尾推导，不依赖后端标记。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObjectInfo(
        String name,
        long size,
        ZonedDateTime lastModified,
        String etag,
        String contentType,
        @JsonProperty("isDir") boolean isDir,
        Map<String, String> metadata
) {
    public static final String DIR_SEPARATOR = "/";

    public static ObjectInfo listed(String name, long size, ZonedDateTime lastModified, String etag) {
        return new ObjectInfo(name, size, lastModified, etag, null, isDirName(name), null);
    }

    public static boolean isDirName(String name) {
        return name != null && name.endsWith(DIR_SEPARATOR);
    }
}
