package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.storage.model.ObjectInfo;
import com.miniomcp.tools.support.AbstractStorageTool;
import com.miniomcp.tools.support.ToolArgs;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.*;
import static com.miniomcp.tools.support.ToolArgs.requireString;
import static com.miniomcp.tools.support.ToolArgs.str;

@AiToolComponent
public class ListObjectsTool extends AbstractStorageTool {

    public ListObjectsTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "list_objects";
    }

    @Override
    public String description() {
        return "List objects in a bucket, optionally filtered by prefix. "
                + "Non-recursive listings return folder entries (names ending with '/').";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props(
                "bucketName", bucket(),
                "prefix", string("Optional name prefix"),
                "recursive", bool("List all nested objects instead of one level", false)
        ), List.of("bucketName"));
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String bucket = requireString(args, "bucketName");
        String prefix = str(args, "prefix");
        boolean recursive = ToolArgs.bool(args, "recursive", false);

        List<ObjectInfo> objects = await(storage.listObjects(connection(), bucket, prefix, recursive));
        long dirs = objects.stream().filter(ObjectInfo::isDir).count();
        String summary = String.format("Found %d object(s) (%d folder(s)) in bucket '%s'%s.",
                objects.size(), dirs, bucket, prefix != null && !prefix.isBlank() ? " under '" + prefix + "'" : "");
        return ok(data("bucketName", bucket, "prefix", prefix, "count", objects.size(), "objects", objects), summary);
    }
}
