package com.miniomcp.ai.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.tools.AiTool;
import com.miniomcp.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Bridges the {@link ToolRegistry} catalogue into Spring AI tool callbacks.
 *
 * <p>Each callback parses the JSON arguments, runs {@link AiTool#execute(Map)} and answers with an
 * envelope carrying {@code tool}, {@code args}, {@code result} and a human-readable {@code text}.
 * Storage failures arrive as {@code ERROR} results and are rendered like any other result, so the
 * model can read the error code and message.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringAiToolAdapter implements ToolCallbackProvider {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ToolRegistry toolRegistry;
    private final ObjectMapper mapper;

    @Override
    public ToolCallback[] getToolCallbacks() {
        return toolRegistry.allTools().stream()
                .map(DelegatingCallback::new)
                .toArray(ToolCallback[]::new);
    }

    private class DelegatingCallback implements ToolCallback {
        private final AiTool tool;
        private final ToolDefinition definition;

        private DelegatingCallback(AiTool tool) {
            this.tool = tool;
            this.definition = ToolDefinition.builder()
                    .name(tool.name())
                    .description(tool.description())
                    .inputSchema(toSchema(tool))
                    .build();
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String argumentsJson) {
            return call(argumentsJson, null);
        }

        @Override
        public String call(String argumentsJson, ToolContext context) {
            return serializeResult(tool, parseArguments(argumentsJson));
        }
    }

    private Map<String, Object> parseArguments(String argumentsJson) {
        if (!StringUtils.hasText(argumentsJson) || "{}".equals(argumentsJson.trim())) {
            return new HashMap<>();
        }
        try {
            return mapper.readValue(argumentsJson, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid tool arguments JSON", e);
        }
    }

    private String serializeResult(AiTool tool, Map<String, Object> args) {
        ToolResult result;
        try {
            result = tool.execute(args);
        } catch (Exception e) {
            log.warn("Tool '{}' invocation failed", tool.name(), e);
            throw new IllegalStateException("Tool execution failed: " + tool.name(), e);
        }
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("tool", tool.name());
        envelope.put("status", result.status());
        envelope.set("args", mapper.valueToTree(maskSecrets(args)));
        JsonNode payload = mapper.valueToTree(result.data());
        envelope.set("result", payload);
        envelope.put("text", payload != null && payload.hasNonNull("text")
                ? payload.get("text").asText()
                : String.valueOf(result.data()));
        return envelope.toString();
    }

    /** minio_connect 的 secretKey 不回显给模型 */
    private static Map<String, Object> maskSecrets(Map<String, Object> args) {
        if (!args.containsKey("secretKey")) {
            return args;
        }
        Map<String, Object> masked = new HashMap<>(args);
        masked.put("secretKey", "****");
        return masked;
    }

    private String toSchema(AiTool tool) {
        try {
            return mapper.writeValueAsString(tool.parametersSchema());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool schema for " + tool.name(), e);
        }
    }
}
