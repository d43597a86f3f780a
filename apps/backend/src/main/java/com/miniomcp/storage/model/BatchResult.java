package com.miniomcp.storage.model;

import com.miniomcp.storage.batch.ItemOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量操作聚合结果。
 * <p>
 * 不变式：{@code success == (failureCount == 0)}，{@code successCount + failureCount == 输入条目数}。
 */
public record BatchResult(
        boolean success,
        int successCount,
        int failureCount,
        List<BatchItemError> errors
) {
    public BatchResult {
        if (successCount < 0 || failureCount < 0) {
            throw new IllegalArgumentException("counts must not be negative: success="
                    + successCount + ", failure=" + failureCount);
        }
        if (success != (failureCount == 0)) {
            throw new IllegalArgumentException("success=" + success + " contradicts failureCount=" + failureCount);
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static BatchResult empty() {
        return new BatchResult(true, 0, 0, List.of());
    }

    public static BatchResult fromOutcomes(List<ItemOutcome> outcomes) {
        int ok = 0;
        List<BatchItemError> errors = new ArrayList<>();
        for (ItemOutcome outcome : outcomes) {
            if (outcome.succeeded()) {
                ok++;
            } else {
                errors.add(new BatchItemError(outcome.item(), outcome.error()));
            }
        }
        return new BatchResult(errors.isEmpty(), ok, errors.size(), errors);
    }

    public int total() {
        return successCount + failureCount;
    }
}
