package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.storage.model.BatchResult;
import com.miniomcp.storage.model.UploadItem;
import com.miniomcp.tools.support.AbstractStorageTool;
import com.miniomcp.tools.support.ToolArgs;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.*;

@AiToolComponent
public class UploadFilesTool extends AbstractStorageTool {

    public UploadFilesTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "upload_files";
    }

    @Override
    public String description() {
        return "Upload several local files or http(s) URLs one after another. "
                + "A failing item is reported and the rest still run.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        Map<String, Object> item = object(props(
                "localPath", string("Local file path or http(s) URL"),
                "objectName", objectName(),
                "metadata", stringMap("Optional object metadata")
        ), List.of("localPath", "objectName"));
        return object(props(
                "bucketName", bucket(),
                "files", arrayOf(item, "Files to upload, processed in order")
        ), List.of("bucketName", "files"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = ToolArgs.requireString(args, "bucketName");
        List<UploadItem> items = ToolArgs.requireObjectList(args, "files").stream()
                .map(f -> new UploadItem(
                        ToolArgs.requireString(f, "localPath"),
                        ToolArgs.requireString(f, "objectName"),
                        ToolArgs.stringMap(f, "metadata")))
                .toList();

        BatchResult result = await(storage.uploadFiles(connection(), bucket, items));
        return ok(data("bucketName", bucket, "result", result), BatchSummaries.describe("Uploaded", result));
    }
}
