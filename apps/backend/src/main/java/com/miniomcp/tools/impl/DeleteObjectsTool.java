package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.storage.model.BatchResult;
import com.miniomcp.tools.support.AbstractStorageTool;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.*;
import static com.miniomcp.tools.support.ToolArgs.requireString;
import static com.miniomcp.tools.support.ToolArgs.requireStringList;

@AiToolComponent
public class DeleteObjectsTool extends AbstractStorageTool {

    public DeleteObjectsTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "delete_objects";
    }

    @Override
    public String description() {
        return "Delete several objects in one request. Reports success and failure per object.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props(
                "bucketName", bucket(),
                "objectNames", arrayOf(Map.of("type", "string"), "Object names to delete")
        ), List.of("bucketName", "objectNames"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = requireString(args, "bucketName");
        List<String> names = requireStringList(args, "objectNames");
        BatchResult result = await(storage.deleteObjects(connection(), bucket, names));
        return ok(data("bucketName", bucket, "result", result), BatchSummaries.describe("Deleted", result));
    }
}
