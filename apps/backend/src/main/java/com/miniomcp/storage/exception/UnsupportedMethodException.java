package com.miniomcp.storage.exception;

public class UnsupportedMethodException extends StorageException {

    public UnsupportedMethodException(String method) {
        super("UnsupportedMethod", "Unsupported HTTP method for presigned URL: " + method);
    }
}
