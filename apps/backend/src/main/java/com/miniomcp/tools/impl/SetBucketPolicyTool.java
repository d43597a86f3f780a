package com.miniomcp.tools.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.tools.support.AbstractStorageTool;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.*;
import static com.miniomcp.tools.support.ToolArgs.requireString;

/**
 * 策略内容对本服务是不透明的 JSON，模型可以传字符串，也可以直接传对象。
 */
@AiToolComponent
public class SetBucketPolicyTool extends AbstractStorageTool {

    private final ObjectMapper mapper;

    public SetBucketPolicyTool(StorageService storage, ConnectionHolder connections, ObjectMapper mapper) {
        super(storage, connections);
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return "set_bucket_policy";
    }

    @Override
    public String description() {
        return "Attach an S3 bucket policy (JSON document) to a bucket, replacing the current one.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props(
                "bucketName", bucket(),
                "policy", Map.of("type", List.of("string", "object"),
                        "description", "Bucket policy JSON, as a string or an object")
        ), List.of("bucketName", "policy"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) throws JsonProcessingException {
        String bucket = requireString(args, "bucketName");
        Object raw = args.get("policy");
        if (raw == null) {
            throw new IllegalArgumentException("Missing required parameter: policy");
        }
        String policy = raw instanceof String s ? s : mapper.writeValueAsString(raw);

        await(storage.setBucketPolicy(connection(), bucket, policy));
        return ok(data("bucketName", bucket, "policyLength", policy.length()),
                "Policy set on bucket '" + bucket + "'.");
    }
}
