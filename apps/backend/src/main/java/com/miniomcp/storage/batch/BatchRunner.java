package com.miniomcp.storage.batch;

import com.miniomcp.storage.model.BatchResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * 顺序执行的批处理：逐条执行、单条失败只记录不中断，最后汇总为 {@link BatchResult}。
 */
@Slf4j
public final class BatchRunner {

    private BatchRunner() {
    }

    public static <T> Mono<BatchResult> runSequentially(List<T> items,
                                                       Function<T, String> idOf,
                                                       Function<T, Mono<?>> operation) {
        if (items == null || items.isEmpty()) {
            return Mono.just(BatchResult.empty());
        }
        return Flux.fromIterable(items)
                .concatMap(item -> attempt(item, idOf, operation))
                .collectList()
                .map(BatchResult::fromOutcomes);
    }

    private static <T> Mono<ItemOutcome> attempt(T item,
                                                 Function<T, String> idOf,
                                                 Function<T, Mono<?>> operation) {
        String id = idOf.apply(item);
        return Mono.defer(() -> operation.apply(item))
                .then(Mono.fromSupplier(() -> ItemOutcome.ok(id)))
                .onErrorResume(err -> {
                    log.debug("[batch] item '{}' failed: {}", id, err.toString());
                    return Mono.just(ItemOutcome.failed(id, err));
                });
    }
}
