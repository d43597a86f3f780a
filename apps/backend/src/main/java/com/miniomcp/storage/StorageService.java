package com.miniomcp.storage;

import com.miniomcp.storage.model.BatchResult;
import com.miniomcp.storage.model.BucketInfo;
import com.miniomcp.storage.model.DownloadItem;
import com.miniomcp.storage.model.ObjectInfo;
import com.miniomcp.storage.model.PresignOptions;
import com.miniomcp.storage.model.StorageStats;
import com.miniomcp.storage.model.UploadItem;
import reactor.core.publisher.Mono;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Object-storage operations. Every call takes the connection handle explicitly; a {@code null}
 * handle fails with {@link com.miniomcp.storage.exception.NotConnectedException} before any
 * backend call.
 */
public interface StorageService {

    // ---- buckets ----

    Mono<List<BucketInfo>> listBuckets(StorageConnection conn);

    /** region 为空时使用连接配置的 region */
    Mono<Void> createBucket(StorageConnection conn, String bucket, String region);

    Mono<Void> deleteBucket(StorageConnection conn, String bucket);

    Mono<Boolean> bucketExists(StorageConnection conn, String bucket);

    // ---- objects ----

    /** 一次性取完全部列举结果 */
    Mono<List<ObjectInfo>> listObjects(StorageConnection conn, String bucket, String prefix, boolean recursive);

    /**
     * 上传本地文件或 http(s) URL。URL 会先下载到临时文件，上传结束后无论成败都会删除。
     */
    Mono<Void> uploadFile(StorageConnection conn, String bucket, String objectName, String source,
                          Map<String, String> metadata);

    /**
     * 上传已打开的流。size 为 null 时走分片上传。流由调用方关闭。
     */
    Mono<Void> uploadStream(StorageConnection conn, String bucket, String objectName, InputStream stream,
                            Long size, Map<String, String> metadata);

    /** 下载到本地文件，父目录不存在时自动创建 */
    Mono<Path> downloadFile(StorageConnection conn, String bucket, String objectName, Path destination);

    /**
     * 获取对象流。
     * 注意：调用方需要在消费完后 close()
     */
    Mono<InputStream> getObjectStream(StorageConnection conn, String bucket, String objectName);

    Mono<Void> deleteObject(StorageConnection conn, String bucket, String objectName);

    Mono<BatchResult> deleteObjects(StorageConnection conn, String bucket, List<String> objectNames);

    Mono<Void> copyObject(StorageConnection conn, String sourceBucket, String sourceObject,
                          String destBucket, String destObject);

    Mono<ObjectInfo> getObjectInfo(StorageConnection conn, String bucket, String objectName);

    /** method 仅支持 GET / PUT / DELETE */
    Mono<String> generatePresignedUrl(StorageConnection conn, String bucket, String objectName,
                                      String method, PresignOptions options);

    // ---- aggregate ----

    Mono<StorageStats> getStorageStats(StorageConnection conn);

    Mono<BatchResult> uploadFiles(StorageConnection conn, String bucket, List<UploadItem> items);

    Mono<BatchResult> downloadFiles(StorageConnection conn, String bucket, List<DownloadItem> items);

    // ---- policy ----

    Mono<Void> setBucketPolicy(StorageConnection conn, String bucket, String policyJson);

    Mono<String> getBucketPolicy(StorageConnection conn, String bucket);

    /** 通过设置空策略实现 */
    Mono<Void> deleteBucketPolicy(StorageConnection conn, String bucket);
}
