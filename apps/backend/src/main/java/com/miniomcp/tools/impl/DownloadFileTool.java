package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.tools.support.AbstractStorageTool;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.*;
import static com.miniomcp.tools.support.ToolArgs.requireString;

@AiToolComponent
public class DownloadFileTool extends AbstractStorageTool {

    public DownloadFileTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "download_file";
    }

    @Override
    public String description() {
        return "Download an object to a local path. Missing parent directories are created.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props(
                "bucketName", bucket(),
                "objectName", objectName(),
                "filePath", string("Destination file path")
        ), List.of("bucketName", "objectName", "filePath"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = requireString(args, "bucketName");
        String objectName = requireString(args, "objectName");
        Path destination = Path.of(requireString(args, "filePath"));

        Path written = await(storage.downloadFile(connection(), bucket, objectName, destination));
        return ok(data("bucketName", bucket, "objectName", objectName, "filePath", written.toString()),
                "Downloaded " + bucket + "/" + objectName + " to " + written + ".");
    }
}
