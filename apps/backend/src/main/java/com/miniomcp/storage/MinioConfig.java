package com.miniomcp.storage;

import com.miniomcp.config.RemoteFetchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Duration;

@Slf4j
@Configuration
@EnableConfigurationProperties({MinioProps.class, RemoteFetchProperties.class})
public class MinioConfig {

    private static final Duration AUTO_CONNECT_TIMEOUT = Duration.ofSeconds(15);

    /**
     * 按 storage.minio.* 自动连接。失败只记日志，服务照常启动，之后可通过 minio_connect 工具重连。
     */
    @Bean
    public ApplicationRunner minioAutoConnect(MinioProps props, ConnectionHolder holder) {
        return args -> {
            if (!props.isAutoConnect() || !StringUtils.hasText(props.getEndpoint())) {
                log.info("MinIO auto-connect skipped (autoConnect={}, endpoint={})",
                        props.isAutoConnect(), props.getEndpoint());
                return;
            }
            try {
                holder.connect(ConnectionConfig.from(props)).block(AUTO_CONNECT_TIMEOUT);
            } catch (Exception e) {
                log.warn("MinIO auto-connect to {}:{} failed: {}", props.getEndpoint(), props.getPort(), e.getMessage());
            }
        };
    }
}
