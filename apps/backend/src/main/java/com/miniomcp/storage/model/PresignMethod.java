package com.miniomcp.storage.model;

import com.miniomcp.storage.exception.UnsupportedMethodException;
import io.minio.http.Method;

import java.util.Locale;

public enum PresignMethod {
    GET(Method.GET),
    PUT(Method.PUT),
    DELETE(Method.DELETE);

    private final Method httpMethod;

    PresignMethod(Method httpMethod) {
        this.httpMethod = httpMethod;
    }

    public Method httpMethod() {
        return httpMethod;
    }

    /** null / 空串按 GET 处理 */
    public static PresignMethod parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return GET;
        }
        String upper = raw.trim().toUpperCase(Locale.ROOT);
        for (PresignMethod m : values()) {
            if (m.name().equals(upper)) {
                return m;
            }
        }
        throw new UnsupportedMethodException(raw);
    }
}
