package com.miniomcp.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.tools.AiTool;
import com.miniomcp.tools.AiToolExecutor;
import com.miniomcp.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

class ToolControllerTest {

    static class BucketExistsStub implements AiTool {
        @Override public String name() { return "bucket_exists"; }
        @Override public String description() { return "Check a bucket"; }
        @Override public Map<String, Object> parametersSchema() {
            return Map.of("type", "object", "properties", Map.of("bucketName", Map.of("type", "string")));
        }
        @Override public ToolResult execute(Map<String, Object> args) {
            Object bucket = args.get("bucketName");
            if (bucket == null) {
                return ToolResult.error(null, name(), "InvalidArgument", "Missing required parameter: bucketName");
            }
            return ToolResult.success(null, name(), Map.of("exists", true, "text", "Bucket '" + bucket + "' exists."));
        }
    }

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        ToolRegistry registry = new ToolRegistry(List.of(new BucketExistsStub()));
        AiToolExecutor executor = new AiToolExecutor(registry, new ObjectMapper());
        client = WebTestClient.bindToController(new ToolController(registry, executor)).build();
    }

    @Test
    void listsToolsAsFunctionDeclarations() {
        client.get().uri("/tools")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].type").isEqualTo("function")
                .jsonPath("$[0].function.name").isEqualTo("bucket_exists");
    }

    @Test
    void invokesToolWithJsonBody() {
        client.post().uri("/tools/bucket_exists")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("bucketName", "photos"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("SUCCESS")
                .jsonPath("$.data.exists").isEqualTo(true)
                .jsonPath("$.callId").exists();
    }

    @Test
    void toolErrorsAreReturnedAsErrorResults() {
        client.post().uri("/tools/bucket_exists")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ERROR")
                .jsonPath("$.data.code").isEqualTo("InvalidArgument");
    }

    @Test
    void unknownToolIsNotFound() {
        client.post().uri("/tools/nope")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .exchange()
                .expectStatus().isNotFound();
    }
}
