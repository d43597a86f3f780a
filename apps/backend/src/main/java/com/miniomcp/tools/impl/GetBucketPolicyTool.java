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
public class GetBucketPolicyTool extends AbstractStorageTool {

    public GetBucketPolicyTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "get_bucket_policy";
    }

    @Override
    public String description() {
        return "Read the bucket policy JSON of a bucket.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props("bucketName", bucket()), List.of("bucketName"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = requireString(args, "bucketName");
        String policy = await(storage.getBucketPolicy(connection(), bucket));
        boolean empty = policy == null || policy.isBlank();
        return ok(data("bucketName", bucket, "policy", empty ? "" : policy),
                empty ? "Bucket '" + bucket + "' has no policy." : "Policy of bucket '" + bucket + "': " + policy);
    }
}
