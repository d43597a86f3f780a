package com.miniomcp.storage.exception;

/**
 * Any other failure reported by the MinIO client, cause preserved.
 */
public class BackendException extends StorageException {

    public BackendException(String operation, Throwable cause) {
        super("BackendError", operation + " failed: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        String msg = cause.getMessage();
        return msg != null ? msg : cause.getClass().getSimpleName();
    }
}
