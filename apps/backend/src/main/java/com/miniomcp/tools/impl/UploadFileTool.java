package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.tools.support.AbstractStorageTool;
import com.miniomcp.tools.support.ToolArgs;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.*;
import static com.miniomcp.tools.support.ToolArgs.requireString;

@AiToolComponent
public class UploadFileTool extends AbstractStorageTool {

    public UploadFileTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "upload_file";
    }

    @Override
    public String description() {
        return "Upload a local file or the content of an http(s) URL to a bucket. "
                + "URLs are downloaded to a temporary file first (30s timeout).";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props(
                "bucketName", bucket(),
                "objectName", objectName(),
                "filePath", string("Local file path or http(s) URL"),
                "metadata", stringMap("Optional object metadata; 'Content-Type' sets the content type")
        ), List.of("bucketName", "objectName", "filePath"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = requireString(args, "bucketName");
        String objectName = requireString(args, "objectName");
        String source = requireString(args, "filePath");
        Map<String, String> metadata = ToolArgs.stringMap(args, "metadata");

        await(storage.uploadFile(connection(), bucket, objectName, source, metadata));
        return ok(data("bucketName", bucket, "objectName", objectName, "source", source),
                "Uploaded '" + source + "' to " + bucket + "/" + objectName + ".");
    }
}
