package com.miniomcp.storage;

import com.miniomcp.storage.exception.NotConnectedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Current connection used by the tool layer. Storage services never read it; they receive the
 * handle explicitly.
 * <p>
 * {@link #connect} replaces the previous connection outright. Do not reconnect while tool calls
 * against the old connection are still running.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionHolder {

    private final StorageConnector connector;
    private final AtomicReference<StorageConnection> current = new AtomicReference<>();

    public Mono<StorageConnection> connect(ConnectionConfig config) {
        return connector.connect(config)
                .doOnNext(conn -> {
                    StorageConnection previous = current.getAndSet(conn);
                    if (previous != null) {
                        log.info("Replaced MinIO connection {} with {}", previous, conn);
                    }
                });
    }

    public Optional<StorageConnection> current() {
        return Optional.ofNullable(current.get());
    }

    public StorageConnection require() {
        StorageConnection conn = current.get();
        if (conn == null) {
            throw new NotConnectedException();
        }
        return conn;
    }
}
