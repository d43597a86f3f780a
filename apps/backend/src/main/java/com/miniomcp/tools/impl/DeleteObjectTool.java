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
public class DeleteObjectTool extends AbstractStorageTool {

    public DeleteObjectTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "delete_object";
    }

    @Override
    public String description() {
        return "Delete one object.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props("bucketName", bucket(), "objectName", objectName()),
                List.of("bucketName", "objectName"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = requireString(args, "bucketName");
        String objectName = requireString(args, "objectName");
        await(storage.deleteObject(connection(), bucket, objectName));
        return ok(data("bucketName", bucket, "objectName", objectName),
                "Deleted " + bucket + "/" + objectName + ".");
    }
}
