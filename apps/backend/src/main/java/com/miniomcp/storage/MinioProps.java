package com.miniomcp.storage;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "storage.minio")
public class MinioProps {
    /** 主机名或 IP，不带协议，例如 play.min.io */
    private String endpoint;
    private int port = ConnectionConfig.DEFAULT_PORT;
    private boolean secure = false;
    private String accessKey;
    private String secretKey;
    private String region = ConnectionConfig.DEFAULT_REGION;

    /** 预签名链接默认有效期（秒） */
    private int presignExpirySeconds = 3600;

    /** 启动时按上述配置自动连接；endpoint 为空时跳过 */
    private boolean autoConnect = true;

    /**
     * 存储统计时每个桶最多扫描的对象数，0 表示不限制。
     * 统计是对所有桶做全量递归列举，对象很多时非常慢。
     */
    private long statsMaxObjectsPerBucket = 0;
}
