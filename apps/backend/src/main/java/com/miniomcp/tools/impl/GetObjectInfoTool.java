package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.storage.model.ObjectInfo;
import com.miniomcp.tools.support.AbstractStorageTool;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.*;
import static com.miniomcp.tools.support.ToolArgs.requireString;

@AiToolComponent
public class GetObjectInfoTool extends AbstractStorageTool {

    public GetObjectInfoTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "get_object_info";
    }

    @Override
    public String description() {
        return "Get size, last-modified time, etag, content type and user metadata of an object.";
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
        ObjectInfo info = await(storage.getObjectInfo(connection(), bucket, objectName));
        String summary = String.format("%s/%s: %d bytes, %s, modified %s.",
                bucket, objectName, info.size(), info.contentType(), info.lastModified());
        return ok(data("bucketName", bucket, "object", info), summary);
    }
}
