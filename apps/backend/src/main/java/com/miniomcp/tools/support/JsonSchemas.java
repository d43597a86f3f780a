package com.miniomcp.tools.support;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 参数层 JSON Schema 的小构造器。
 */
public final class JsonSchemas {

    private JsonSchemas() {
    }

    public static Map<String, Object> object(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    public static Map<String, Object> string(String description) {
        return Map.of("type", "string", "description", description);
    }

    public static Map<String, Object> bool(String description, boolean def) {
        return Map.of("type", "boolean", "description", description, "default", def);
    }

    public static Map<String, Object> integer(String description) {
        return Map.of("type", "integer", "description", description);
    }

    public static Map<String, Object> stringMap(String description) {
        return Map.of("type", "object", "description", description,
                "additionalProperties", Map.of("type", "string"));
    }

    public static Map<String, Object> arrayOf(Map<String, Object> items, String description) {
        return Map.of("type", "array", "description", description, "items", items);
    }

    public static Map<String, Object> props(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            m.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return m;
    }

    public static Map<String, Object> bucket() {
        return string("Bucket name");
    }

    public static Map<String, Object> objectName() {
        return string("Object name (key) inside the bucket");
    }
}
