package com.miniomcp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "storage.remote-fetch")
public class RemoteFetchProperties {

    /** 整个请求（含响应体落盘）的超时 */
    private Duration timeout = Duration.ofSeconds(30);

    /** 临时文件目录，为空时用 java.io.tmpdir */
    private String tempDir;

    private String tempPrefix = "minio_mcp_temp_";

    private String userAgent = "minio-mcp/1.0";
}
