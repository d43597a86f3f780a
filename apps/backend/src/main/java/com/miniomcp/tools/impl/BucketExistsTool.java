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
public class BucketExistsTool extends AbstractStorageTool {

    public BucketExistsTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "bucket_exists";
    }

    @Override
    public String description() {
        return "Check whether a bucket exists.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props("bucketName", bucket()), List.of("bucketName"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = requireString(args, "bucketName");
        boolean exists = Boolean.TRUE.equals(await(storage.bucketExists(connection(), bucket)));
        return ok(data("bucketName", bucket, "exists", exists),
                "Bucket '" + bucket + "' " + (exists ? "exists." : "does not exist."));
    }
}
