package com.miniomcp.tools.impl;

import com.miniomcp.ai.tools.AiToolComponent;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionConfig;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.MinioProps;
import com.miniomcp.storage.StorageConnection;
import com.miniomcp.storage.StorageService;
import com.miniomcp.tools.support.AbstractStorageTool;

import java.util.List;
import java.util.Map;

import static com.miniomcp.tools.support.JsonSchemas.bool;
import static com.miniomcp.tools.support.JsonSchemas.integer;
import static com.miniomcp.tools.support.JsonSchemas.object;
import static com.miniomcp.tools.support.JsonSchemas.props;
import static com.miniomcp.tools.support.JsonSchemas.string;
import static com.miniomcp.tools.support.ToolArgs.boolOrNull;
import static com.miniomcp.tools.support.ToolArgs.intOrNull;
import static com.miniomcp.tools.support.ToolArgs.str;

/**
 * minio_connect：替换当前连接。未传的字段回落到 storage.minio.* 配置。
 */
@AiToolComponent
public class ConnectTool extends AbstractStorageTool {

    private final MinioProps defaults;

    public ConnectTool(StorageService storage, ConnectionHolder connections, MinioProps defaults) {
        super(storage, connections);
        this.defaults = defaults;
    }

    @Override
    public String name() {
        return "minio_connect";
    }

    @Override
    public String description() {
        return "Connect to a MinIO / S3 compatible server. Replaces the current connection. "
                + "Omitted fields fall back to the server configuration (port 9000, SSL off, region us-east-1).";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return object(props(
                "endpoint", string("Server host name or IP, without scheme, e.g. 'play.min.io'"),
                "port", integer("Server port, default 9000"),
                "useSSL", bool("Use HTTPS", false),
                "accessKey", string("Access key"),
                "secretKey", string("Secret key"),
                "region", string("Region, default us-east-1")
        ), List.of());
    }

    @Override
    protected ToolResult run(Map<String, Object> args) {
        String endpoint = firstNonBlank(str(args, "endpoint"), defaults.getEndpoint());
        Integer port = intOrNull(args, "port");
        Boolean useSsl = boolOrNull(args, "useSSL");
        ConnectionConfig config = ConnectionConfig.of(
                endpoint,
                port != null ? port : defaults.getPort(),
                useSsl != null ? useSsl : defaults.isSecure(),
                firstNonBlank(str(args, "accessKey"), defaults.getAccessKey()),
                firstNonBlank(str(args, "secretKey"), defaults.getSecretKey()),
                firstNonBlank(str(args, "region"), defaults.getRegion()));

        StorageConnection conn = await(connections().connect(config));
        int buckets = await(storage.listBuckets(conn)).size();

        String summary = String.format("Connected to %s (%d bucket(s) visible).", config.describeEndpoint(), buckets);
        return ok(data(
                "endpoint", config.endpoint(),
                "port", config.port(),
                "useSSL", config.useSsl(),
                "region", config.region(),
                "bucketCount", buckets), summary);
    }

    private static String firstNonBlank(String a, String b) {
        return a != null && !a.isBlank() ? a : b;
    }
}
