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
public class CopyObjectTool extends AbstractStorageTool {

    public CopyObjectTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "copy_object";
    }

    @Override
    public String description() {
        return "Server-side copy of an object, possibly across buckets.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props(
                "sourceBucket", string("Source bucket"),
                "sourceObject", string("Source object name"),
                "destBucket", string("Destination bucket"),
                "destObject", string("Destination object name")
        ), List.of("sourceBucket", "sourceObject", "destBucket", "destObject"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String sourceBucket = requireString(args, "sourceBucket");
        String sourceObject = requireString(args, "sourceObject");
        String destBucket = requireString(args, "destBucket");
        String destObject = requireString(args, "destObject");

        await(storage.copyObject(connection(), sourceBucket, sourceObject, destBucket, destObject));
        return ok(data("source", sourceBucket + "/" + sourceObject, "destination", destBucket + "/" + destObject),
                "Copied " + sourceBucket + "/" + sourceObject + " to " + destBucket + "/" + destObject + ".");
    }
}
