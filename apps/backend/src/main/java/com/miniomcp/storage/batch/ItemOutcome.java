package com.miniomcp.storage.batch;

/**
 * Per-item outcome of a batch step: either success or {item, error}.
 */
public record ItemOutcome(String item, String error) {

    public static ItemOutcome ok(String item) {
        return new ItemOutcome(item, null);
    }

    public static ItemOutcome failed(String item, Throwable cause) {
        return new ItemOutcome(item, describe(cause));
    }

    public static ItemOutcome failed(String item, String error) {
        return new ItemOutcome(item, error == null ? "unknown error" : error);
    }

    public boolean succeeded() {
        return error == null;
    }

    static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        String msg = cause.getMessage();
        return msg != null ? msg : cause.getClass().getSimpleName();
    }
}
