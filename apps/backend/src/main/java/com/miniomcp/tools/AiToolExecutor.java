package com.miniomcp.tools;

import com.miniomcp.api.dto.ToolResult;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Runs tool calls against the {@link ToolRegistry}, strictly in order.
 * <p>
 * Tools report storage failures as {@code ERROR} results themselves; anything they throw is
 * logged here and rethrown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AiToolExecutor {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ToolRegistry registry;
    private final ObjectMapper mapper;

    public record ToolCall(String id, String name, String argumentsJson) {}

    public ToolResult execute(String name, Map<String, Object> args) throws Exception {
        AiTool tool = registry.get(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tool: " + name));
        Map<String, Object> effective = args == null ? new HashMap<>() : new HashMap<>(args);
        try {
            ToolResult result = tool.execute(effective);
            log.debug("[EXEC-OK] tool={} status={}", tool.name(), result.status());
            return result;
        } catch (Exception ex) {
            log.error("[EXEC-ERR] tool={} ex={}: {}", tool.name(), ex.getClass().getSimpleName(), ex.getMessage(), ex);
            throw ex;
        }
    }

    /**
     * 按顺序执行，返回 OpenAI 风格的 tool 消息（content 为 data 的 JSON）。
     */
    public List<Map<String, Object>> executeAll(List<ToolCall> calls) throws Exception {
        log.debug("Executing {} tool call(s)", calls.size());
        List<Map<String, Object>> results = new ArrayList<>();

        for (ToolCall call : calls) {
            Map<String, Object> args = mapper.readValue(
                    call.argumentsJson() == null || call.argumentsJson().isBlank() ? "{}" : call.argumentsJson(),
                    MAP_TYPE);

            ToolResult result = execute(call.name(), args).withCallId(call.id());
            String content = mapper.writeValueAsString(result.data());

            results.add(Map.of(
                    "role", "tool",
                    "tool_call_id", call.id(),
                    "content", content
            ));
            log.debug("Tool '{}' call id={} produced payloadLength={}", call.name(), call.id(), content.length());
        }
        return results;
    }
}
