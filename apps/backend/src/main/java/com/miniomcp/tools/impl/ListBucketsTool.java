package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageService;
import com.miniomcp.storage.model.BucketInfo;
import com.miniomcp.tools.support.AbstractStorageTool;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.object;
import static com.miniomcp.tools.support.JsonSchemas.props;

@AiToolComponent
public class ListBucketsTool extends AbstractStorageTool {

    public ListBucketsTool(StorageService storage, ConnectionHolder connections) {
        super(storage, connections);
    }

    @Override
    public String name() {
        return "list_buckets";
    }

    @Override
    public String description() {
        return "List all buckets with their creation dates.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props(), List.of());
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        List<BucketInfo> buckets = await(storage.listBuckets(connection()));
        String summary = buckets.isEmpty()
                ? "No buckets found."
                : String.format("Found %d bucket(s): %s", buckets.size(),
                String.join(", ", buckets.stream().map(BucketInfo::name).toList()));
        return ok(data("count", buckets.size(), "buckets", buckets), summary);
    }
}
