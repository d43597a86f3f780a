package com.miniomcp.storage.exception;

/**
 * Raised when an operation runs without a live connection.
 */
public class NotConnectedException extends StorageException {

    public NotConnectedException() {
        super("NotConnected", "Not connected to a MinIO server, call minio_connect first");
    }
}
