package com.miniomcp.storage.exception;

import lombok.Getter;

/**
 * 存储层异常基类，{@code errorCode} 原样回传给工具调用方。
 */
@Getter
public class StorageException extends RuntimeException {

    private final String errorCode;

    public StorageException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StorageException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
