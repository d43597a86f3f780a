package com.miniomcp.storage;

import com.miniomcp.storage.exception.ConnectionFailureException;
import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Builds a {@link MinioClient} and probes it with {@code listBuckets} before handing out a
 * {@link StorageConnection}.
 */
@Slf4j
@Component
public class StorageConnector {

    public Mono<StorageConnection> connect(ConnectionConfig config) {
        return Mono.fromCallable(() -> {
                    MinioClient client = buildClient(config);
                    try {
                        client.listBuckets();
                    } catch (Exception e) {
                        throw new ConnectionFailureException(config.describeEndpoint(), e);
                    }
                    log.info("Connected to MinIO at {}", config.describeEndpoint());
                    return new StorageConnection(config, client);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    protected MinioClient buildClient(ConnectionConfig config) {
        return MinioClient.builder()
                .endpoint(config.endpoint(), config.port(), config.useSsl())
                .credentials(config.accessKey(), config.secretKey())
                .region(config.region())
                .build();
    }
}
