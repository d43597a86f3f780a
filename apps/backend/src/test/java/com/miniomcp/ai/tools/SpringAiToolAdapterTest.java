package com.miniomcp.ai.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.tools.AiTool;
import com.miniomcp.tools.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpringAiToolAdapterTest {

    static class BucketCountTool implements AiTool {
        Map<String, Object> lastArgs;

        @Override public String name() { return "list_buckets"; }
        @Override public String description() { return "List buckets"; }
        @Override public Map<String, Object> parametersSchema() {
            return Map.of("type", "object", "properties", Map.of());
        }
        @Override public ToolResult execute(Map<String, Object> args) throws Exception {
            lastArgs = args;
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("count", 2);
            data.put("text", "Found 2 bucket(s).");
            return ToolResult.success(null, name(), data);
        }
    }

    static class FailingTool extends BucketCountTool {
        @Override public String name() { return "broken"; }
        @Override public ToolResult execute(Map<String, Object> args) throws Exception {
            throw new java.io.IOException("disk gone");
        }
    }

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void exposesOneCallbackPerRegisteredTool() {
        SpringAiToolAdapter adapter = new SpringAiToolAdapter(new ToolRegistry(List.of(new BucketCountTool())), mapper);

        ToolCallback[] callbacks = adapter.getToolCallbacks();

        assertEquals(1, callbacks.length);
        assertEquals("list_buckets", callbacks[0].getToolDefinition().name());
        assertEquals("List buckets", callbacks[0].getToolDefinition().description());
        assertTrue(callbacks[0].getToolDefinition().inputSchema().contains("\"object\""));
    }

    @Test
    void callWrapsResultInEnvelopeWithText() throws Exception {
        BucketCountTool tool = new BucketCountTool();
        SpringAiToolAdapter adapter = new SpringAiToolAdapter(new ToolRegistry(List.of(tool)), mapper);

        String out = adapter.getToolCallbacks()[0].call("{\"secretKey\":\"hidden\",\"x\":1}");

        JsonNode envelope = mapper.readTree(out);
        assertEquals("list_buckets", envelope.path("tool").asText());
        assertEquals(ToolResult.SUCCESS, envelope.path("status").asText());
        assertEquals(2, envelope.path("result").path("count").asInt());
        assertEquals("Found 2 bucket(s).", envelope.path("text").asText());
        assertEquals("****", envelope.path("args").path("secretKey").asText());
        assertEquals("hidden", tool.lastArgs.get("secretKey"));
    }

    @Test
    void emptyArgumentsAreAccepted() {
        BucketCountTool tool = new BucketCountTool();
        SpringAiToolAdapter adapter = new SpringAiToolAdapter(new ToolRegistry(List.of(tool)), mapper);

        adapter.getToolCallbacks()[0].call("");

        assertTrue(tool.lastArgs.isEmpty());
    }

    @Test
    void malformedJsonIsRejected() {
        SpringAiToolAdapter adapter = new SpringAiToolAdapter(new ToolRegistry(List.of(new BucketCountTool())), mapper);

        assertThrows(IllegalArgumentException.class, () -> adapter.getToolCallbacks()[0].call("{not json"));
    }

    @Test
    void unexpectedToolFailureSurfacesAsIllegalState() {
        SpringAiToolAdapter adapter = new SpringAiToolAdapter(new ToolRegistry(List.of(new FailingTool())), mapper);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> adapter.getToolCallbacks()[0].call("{}"));
        assertTrue(ex.getMessage().contains("broken"));
    }
}
