package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.storage.model.PresignOptions;
import com.miniomcp.tools.support.AbstractStorageTool;
import com.miniomcp.tools.support.ToolArgs;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.*;

@AiToolComponent
public class GeneratePresignedUrlTool extends AbstractStorageTool {

    public GeneratePresignedUrlTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "generate_presigned_url";
    }

    @Override
    public String description() {
        return "Generate a time-limited URL for GET, PUT or DELETE on an object without sharing credentials.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props(
                "bucketName", bucket(),
                "objectName", objectName(),
                "method", Map.of("type", "string", "enum", List.of("GET", "PUT", "DELETE"), "default", "GET"),
                "expires", integer("Validity in seconds, default 3600, at most 7 days"),
                "reqParams", stringMap("Extra query parameters signed into GET/DELETE URLs, "
                        + "e.g. response-content-type"),
                "requestDate", string("Optional ISO-8601 start of the validity window")
        ), List.of("bucketName", "objectName"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = ToolArgs.requireString(args, "bucketName");
        String objectName = ToolArgs.requireString(args, "objectName");
        String method = ToolArgs.str(args, "method");
        PresignOptions options = new PresignOptions(
                ToolArgs.intOrNull(args, "expires"),
                ToolArgs.stringMap(args, "reqParams"),
                ToolArgs.dateTimeOrNull(args, "requestDate"));

        String url = await(storage.generatePresignedUrl(connection(), bucket, objectName, method, options));
        String effectiveMethod = method == null || method.isBlank() ? "GET" : method.toUpperCase();
        return ok(data("bucketName", bucket, "objectName", objectName, "method", effectiveMethod, "url", url),
                "Presigned " + effectiveMethod + " URL for " + bucket + "/" + objectName + ": " + url);
    }
}
