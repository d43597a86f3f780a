package com.miniomcp.tools.support;

import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.StorageConnection;
import com.miniomcp.storage.StorageService;
import com.miniomcp.storage.exception.StorageException;
import com.miniomcp.tools.AiTool;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for storage tools: resolves the current connection and turns storage and argument
 * failures into {@code ERROR} results. Anything else propagates to the executor.
 */
@Slf4j
public abstract class AbstractStorageTool implements AiTool {

    protected final StorageService storage;
    private final ConnectionHolder connections;

    protected AbstractStorageTool(StorageService storage, ConnectionHolder connections) {
        this.storage = storage;
        this.connections = connections;
    }

    @Override
    public final ToolResult execute(Map<String, Object> args) throws Exception {
        Map<String, Object> safeArgs = args == null ? Map.of() : args;
        try {
            return run(safeArgs);
        } catch (StorageException e) {
            log.warn("[{}] {}: {}", name(), e.getErrorCode(), e.getMessage());
            return ToolResult.error(null, name(), e.getErrorCode(), e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("[{}] invalid args: {}", name(), e.getMessage());
            return ToolResult.error(null, name(), "InvalidArgument", e.getMessage());
        }
    }

    protected abstract ToolResult run(Map<String, Object> args) throws Exception;

    protected StorageConnection connection() {
        return connections.require();
    }

    protected ConnectionHolder connections() {
        return connections;
    }

    protected static <T> T await(Mono<T> mono) {
        return mono.block();
    }

    protected ToolResult ok(String text) {
        return ok(new LinkedHashMap<>(), text);
    }

    protected ToolResult ok(Map<String, Object> data, String text) {
        data.put("text", text);
        return ToolResult.success(null, name(), data);
    }

    protected static Map<String, Object> data(Object... kv) {
        return JsonSchemas.props(kv);
    }
}
