package com.miniomcp.tools.support;

import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工具参数解析。模型传参类型不稳定（数字可能是字符串、布尔可能是 "true"），这里统一兜底。
 */
public final class ToolArgs {

    private ToolArgs() {
    }

    public static String str(Map<String, Object> args, String key) {
        Object v = args.get(key);
        return v == null ? null : String.valueOf(v);
    }

    public static String requireString(Map<String, Object> args, String key) {
        String v = str(args, key);
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("Missing required parameter: " + key);
        }
        return v;
    }

    public static boolean bool(Map<String, Object> args, String key, boolean def) {
        Object v = args.get(key);
        if (v instanceof Boolean b) return b;
        if (v instanceof String s && !s.isBlank()) return Boolean.parseBoolean(s.trim());
        return def;
    }

    public static Boolean boolOrNull(Map<String, Object> args, String key) {
        return args.get(key) == null ? null : bool(args, key, false);
    }

    public static Integer intOrNull(Map<String, Object> args, String key) {
        Object v = args.get(key);
        if (v instanceof Number n) return n.intValue();
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter '" + key + "' must be an integer, got: " + s);
            }
        }
        return null;
    }

    /** 值统一转字符串，null 值丢弃 */
    public static Map<String, String> stringMap(Map<String, Object> args, String key) {
        Object v = args.get(key);
        if (v == null) return null;
        if (!(v instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an object");
        }
        Map<String, String> out = new LinkedHashMap<>();
        raw.forEach((k, val) -> {
            if (k != null && val != null) out.put(String.valueOf(k), String.valueOf(val));
        });
        return out;
    }

    public static List<String> requireStringList(Map<String, Object> args, String key) {
        Object v = args.get(key);
        if (!(v instanceof List<?> raw)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an array of strings");
        }
        List<String> out = new ArrayList<>(raw.size());
        for (Object o : raw) {
            if (o == null) throw new IllegalArgumentException("Parameter '" + key + "' contains null");
            out.add(String.valueOf(o));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> requireObjectList(Map<String, Object> args, String key) {
        Object v = args.get(key);
        if (!(v instanceof List<?> raw)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an array of objects");
        }
        List<Map<String, Object>> out = new ArrayList<>(raw.size());
        for (Object o : raw) {
            if (!(o instanceof Map<?, ?>)) {
                throw new IllegalArgumentException("Parameter '" + key + "' must contain only objects");
            }
            out.add((Map<String, Object>) o);
        }
        return out;
    }

    /** ISO-8601，带时区偏移 */
    public static ZonedDateTime dateTimeOrNull(Map<String, Object> args, String key) {
        String s = str(args, key);
        if (s == null || s.isBlank()) return null;
        try {
            return OffsetDateTime.parse(s.trim()).toZonedDateTime();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an ISO-8601 date-time, got: " + s);
        }
    }
}
