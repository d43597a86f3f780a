package com.miniomcp.api.dto;

import java.util.LinkedHashMap;
import java.util.Map;

public record ToolResult(
        String callId,
        String name,
        String status, // "SUCCESS" | "ERROR"
        Object data    // result or error envelope
) {
    public static final String SUCCESS = "SUCCESS";
    public static final String ERROR = "ERROR";

    public static ToolResult success(String callId, String name, Object data) {
        return new ToolResult(callId, name, SUCCESS, data);
    }

    /** 错误同样带 text，方便模型直接阅读 */
    public static ToolResult error(String callId, String name, String code, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("code", code);
        data.put("message", message);
        data.put("text", name + " failed (" + code + "): " + message);
        return new ToolResult(callId, name, ERROR, data);
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public ToolResult withCallId(String id) {
        return new ToolResult(id, name, status, data);
    }
}
