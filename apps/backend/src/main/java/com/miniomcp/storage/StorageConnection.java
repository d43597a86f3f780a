package com.miniomcp.storage;

import io.minio.MinioClient;

import java.util.Objects;

/**
 * 一次成功 connect 得到的连接句柄，所有存储操作都显式传入。
 */
public record StorageConnection(ConnectionConfig config, MinioClient client) {

    public StorageConnection {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(client, "client");
    }

    @Override
    public String toString() {
        return "StorageConnection[" + config.describeEndpoint() + "]";
    }
}
