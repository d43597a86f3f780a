package com.miniomcp.storage.batch;

import com.miniomcp.storage.model.BatchResult;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class BatchRunnerTest {

    @Test
    void emptyInputIsSuccessWithZeroCounts() {
        StepVerifier.create(BatchRunner.runSequentially(List.<String>of(), Function.identity(), s -> Mono.empty()))
                .expectNext(BatchResult.empty())
                .verifyComplete();
    }

    @Test
    void runsItemsInOrderAndRecordsFailuresWithoutAborting() {
        List<String> visited = new ArrayList<>();

        Mono<BatchResult> batch = BatchRunner.runSequentially(List.of("a", "b", "c", "d"), Function.identity(), item -> {
            visited.add(item);
            if (item.equals("b")) {
                return Mono.error(new IllegalStateException("b is broken"));
            }
            if (item.equals("d")) {
                throw new IllegalArgumentException("d rejected synchronously");
            }
            return Mono.empty();
        });

        StepVerifier.create(batch)
                .assertNext(result -> {
                    assertFalse(result.success());
                    assertEquals(2, result.successCount());
                    assertEquals(2, result.failureCount());
                    assertEquals(4, result.total());
                    assertEquals("b", result.errors().get(0).item());
                    assertEquals("b is broken", result.errors().get(0).error());
                    assertEquals("d", result.errors().get(1).item());
                })
                .verifyComplete();

        assertEquals(List.of("a", "b", "c", "d"), visited);
    }

    @Test
    void errorWithoutMessageFallsBackToExceptionType() {
        StepVerifier.create(BatchRunner.runSequentially(List.of("x"), Function.identity(),
                        item -> Mono.error(new NullPointerException())))
                .assertNext(result -> assertEquals("NullPointerException", result.errors().get(0).error()))
                .verifyComplete();
    }
}
