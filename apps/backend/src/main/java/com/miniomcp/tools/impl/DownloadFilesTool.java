package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.storage.model.BatchResult;
import com.miniomcp.storage.model.DownloadItem;
import com.miniomcp.tools.support.AbstractStorageTool;
import com.miniomcp.tools.support.ToolArgs;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.*;

@AiToolComponent
public class DownloadFilesTool extends AbstractStorageTool {

    public DownloadFilesTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "download_files";
    }

    @Override
    public String description() {
        return "Download several objects to local paths one after another. "
                + "A failing item is reported and the rest still run.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        Map<String, Object> item = object(props(
                "objectName", objectName(),
                "localPath", string("Destination file path")
        ), List.of("objectName", "localPath"));
        return object(props(
                "bucketName", bucket(),
                "files", arrayOf(item, "Objects to download, processed in order")
        ), List.of("bucketName", "files"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = ToolArgs.requireString(args, "bucketName");
        List<DownloadItem> items = ToolArgs.requireObjectList(args, "files").stream()
                .map(f -> new DownloadItem(
                        ToolArgs.requireString(f, "objectName"),
                        ToolArgs.requireString(f, "localPath")))
                .toList();

        BatchResult result = await(storage.downloadFiles(connection(), bucket, items));
        return ok(data("bucketName", bucket, "result", result), BatchSummaries.describe("Downloaded", result));
    }
}
