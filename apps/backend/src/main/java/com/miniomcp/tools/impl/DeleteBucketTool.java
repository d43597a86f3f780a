package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.tools.support.AbstractStorageTool;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.*;
import static com.miniomcp.tools.support.ToolArgs.requireString;

@AiToolComponent
public class DeleteBucketTool extends AbstractStorageTool {

    public DeleteBucketTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "delete_bucket";
    }

    @Override
    public String description() {
        return "Delete an empty bucket.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props("bucketName", bucket()), List.of("bucketName"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = requireString(args, "bucketName");
        await(storage.deleteBucket(connection(), bucket));
        return ok(data("bucketName", bucket), "Bucket '" + bucket + "' deleted.");
    }
}
