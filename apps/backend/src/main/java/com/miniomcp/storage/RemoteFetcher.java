package com.miniomcp.storage;

import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * 把 http(s) 资源下载到本地临时文件，供上传前使用。
 */
public interface RemoteFetcher {

    /** 仅 http / https 视为远程资源；解析失败或其他协议一律当作本地路径 */
    boolean isFetchable(String source);

    /**
     * 下载到一个新的临时文件。任何失败路径（非 2xx、传输错误、超时）都会先删除已写入的部分文件。
     */
    Mono<Path> fetchToTempFile(String url);

    /** 尽力删除临时文件，失败只记日志 */
    Mono<Void> discard(Path tempFile);
}
