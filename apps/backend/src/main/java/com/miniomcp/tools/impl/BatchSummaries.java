package com.miniomcp.tools.impl;

import com.miniomcp.storage.model.BatchItemError;
import com.miniomcp.storage.model.BatchResult;

import java.util.stream.Collectors;

final class BatchSummaries {

    private static final int MAX_LISTED_ERRORS = 5;

    private BatchSummaries() {
    }

    static String describe(String verb, BatchResult result) {
        StringBuilder sb = new StringBuilder()
                .append(verb).append(' ').append(result.successCount()).append(" of ")
                .append(result.total()).append(" item(s)");
        if (result.failureCount() == 0) {
            return sb.append('.').toString();
        }
        String errors = result.errors().stream()
                .limit(MAX_LISTED_ERRORS)
                .map(BatchItemError::item)
                .collect(Collectors.joining(", "));
        sb.append("; ").append(result.failureCount()).append(" failed: ").append(errors);
        if (result.errors().size() > MAX_LISTED_ERRORS) {
            sb.append(", ...");
        }
        return sb.toString();
    }
}
