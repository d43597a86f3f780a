package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.storage.model.StorageStats;
import com.miniomcp.tools.support.AbstractStorageTool;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.object;
import static com.miniomcp.tools.support.JsonSchemas.props;

@AiToolComponent
public class GetStorageStatsTool extends AbstractStorageTool {

    public GetStorageStatsTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "get_storage_stats";
    }

    @Override
    public String description() {
        return "Count objects and bytes per bucket and in total. Lists every object of every bucket, "
                + "so it is slow on large deployments.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props(), List.of());
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        StorageStats stats = await(storage.getStorageStats(connection()));
        String summary = String.format("%d bucket(s), %d object(s), %d bytes in total.",
                stats.totalBuckets(), stats.totalObjects(), stats.totalSize());
        return ok(data("stats", stats), summary);
    }
}
