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
import static com.miniomcp.tools.support.ToolArgs.str;

@AiToolComponent
public class CreateBucketTool extends AbstractStorageTool {

    public CreateBucketTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "create_bucket";
    }

    @Override
    public String description() {
        return "Create a bucket. Region defaults to the connection region.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props(
                "bucketName", bucket(),
                "region", string("Optional region")
        ), List.of("bucketName"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = requireString(args, "bucketName");
        await(storage.createBucket(connection(), bucket, str(args, "region")));
        return ok(data("bucketName", bucket), "Bucket '" + bucket + "' created.");
    }
}
