package com.miniomcp.storage.exception;

/**
 * 远程 URL 下载失败：非 2xx、传输错误或超时。
 */
public class RemoteFetchException extends StorageException {

    public RemoteFetchException(String message) {
        super("RemoteFetchFailure", message);
    }

    public RemoteFetchException(String message, Throwable cause) {
        super("RemoteFetchFailure", message, cause);
    }
}
