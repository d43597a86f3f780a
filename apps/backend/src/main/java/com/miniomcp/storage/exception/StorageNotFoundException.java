package com.miniomcp.storage.exception;

/**
 * Local file or remote object/bucket missing.
 */
public class StorageNotFoundException extends StorageException {

    public StorageNotFoundException(String message) {
        super("NotFound", message);
    }

    public StorageNotFoundException(String message, Throwable cause) {
        super("NotFound", message, cause);
    }

    public static StorageNotFoundException localFile(String path) {
        return new StorageNotFoundException("File not found: " + path);
    }
}
