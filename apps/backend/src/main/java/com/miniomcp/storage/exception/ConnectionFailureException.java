package com.miniomcp.storage.exception;

public class ConnectionFailureException extends StorageException {

    public ConnectionFailureException(String endpoint, Throwable cause) {
        super("ConnectionFailure", "Failed to connect to MinIO server " + endpoint + ": " + cause.getMessage(), cause);
    }
}
