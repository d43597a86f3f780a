package com.miniomcp.storage.impl;

import com.miniomcp.storage.MinioProps;
import com.miniomcp.storage.RemoteFetcher;
import com.miniomcp.storage.StorageConnection;
import com.miniomcp.storage.StorageService;
import com.miniomcp.storage.batch.BatchRunner;
import com.miniomcp.storage.batch.ItemOutcome;
import com.miniomcp.storage.exception.BackendException;
import com.miniomcp.storage.exception.NotConnectedException;
import com.miniomcp.storage.exception.StorageException;
import com.miniomcp.storage.exception.StorageNotFoundException;
import com.miniomcp.storage.model.BatchResult;
import com.miniomcp.storage.model.BucketInfo;
import com.miniomcp.storage.model.BucketStats;
import com.miniomcp.storage.model.DownloadItem;
import com.miniomcp.storage.model.ObjectInfo;
import com.miniomcp.storage.model.PresignMethod;
import com.miniomcp.storage.model.PresignOptions;
import com.miniomcp.storage.model.StorageStats;
import com.miniomcp.storage.model.UploadItem;
import io.minio.*;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.DeleteError;
import io.minio.messages.DeleteObject;
import io.minio.messages.Item;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

@Slf4j
@Service
@RequiredArgsConstructor
public class MinioStorageService implements StorageService {

    /** MinIO 预签名最长 7 天（含） */
    static final long MAX_PRESIGN_SECONDS = 7L * 24 * 60 * 60;

    /** 未知长度的流按 10MiB 分片上传 */
    static final long STREAM_PART_SIZE = 10L * 1024 * 1024;

    private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "NoSuchBucket", "NoSuchObject");
    private static final String CONTENT_TYPE = "content-type";

    private final RemoteFetcher remoteFetcher;
    private final MinioProps props;
    private final Tika tika = new Tika();

    @FunctionalInterface
    interface MinioCall<T> {
        T apply(MinioClient client) throws Exception;
    }

    @FunctionalInterface
    interface MinioRun {
        void run(MinioClient client) throws Exception;
    }

    // ========= 桶 =========

    @Override
    public Mono<List<BucketInfo>> listBuckets(StorageConnection conn) {
        return call(conn, "listBuckets", c -> c.listBuckets().stream()
                .map(b -> new BucketInfo(b.name(), b.creationDate()))
                .toList());
    }

    @Override
    public Mono<Void> createBucket(StorageConnection conn, String bucket, String region) {
        return run(conn, "createBucket", c -> {
            String effective = StringUtils.hasText(region) ? region : conn.config().region();
            c.makeBucket(MakeBucketArgs.builder().bucket(bucket).region(effective).build());
            log.debug("Created bucket '{}' in region '{}'", bucket, effective);
        });
    }

    @Override
    public Mono<Void> deleteBucket(StorageConnection conn, String bucket) {
        return run(conn, "deleteBucket",
                c -> c.removeBucket(RemoveBucketArgs.builder().bucket(bucket).build()));
    }

    @Override
    public Mono<Boolean> bucketExists(StorageConnection conn, String bucket) {
        return call(conn, "bucketExists",
                c -> c.bucketExists(BucketExistsArgs.builder().bucket(bucket).build()));
    }

    // ========= 对象 =========

    @Override
    public Mono<List<ObjectInfo>> listObjects(StorageConnection conn, String bucket, String prefix, boolean recursive) {
        return call(conn, "listObjects", c -> {
            List<ObjectInfo> objects = new ArrayList<>();
            for (Result<Item> result : c.listObjects(listArgs(bucket, prefix, recursive))) {
                objects.add(toObjectInfo(result.get()));
            }
            return objects;
        });
    }

    @Override
    public Mono<Void> uploadFile(StorageConnection conn, String bucket, String objectName, String source,
                                 Map<String, String> metadata) {
        if (conn == null) {
            return Mono.error(new NotConnectedException());
        }
        if (remoteFetcher.isFetchable(source)) {
            // 临时文件在上传结束（成功/失败/取消）后删除，删除先于结果下发
            return Mono.usingWhen(
                    remoteFetcher.fetchToTempFile(source),
                    temp -> putFile(conn, bucket, objectName, temp, metadata),
                    remoteFetcher::discard);
        }
        if (!StringUtils.hasText(source)) {
            return Mono.error(StorageNotFoundException.localFile(String.valueOf(source)));
        }
        Path local;
        try {
            local = Path.of(source);
        } catch (InvalidPathException e) {
            return Mono.error(new StorageNotFoundException("File not found: " + source, e));
        }
        return putFile(conn, bucket, objectName, local, metadata);
    }

    @Override
    public Mono<Void> uploadStream(StorageConnection conn, String bucket, String objectName, InputStream stream,
                                   Long size, Map<String, String> metadata) {
        return run(conn, "uploadStream", c -> {
            Map<String, String> userMetadata = new LinkedHashMap<>();
            String contentType = splitContentType(metadata, userMetadata);
            long objectSize = size != null && size >= 0 ? size : -1;
            long partSize = objectSize < 0 ? STREAM_PART_SIZE : -1;

            PutObjectArgs.Builder args = PutObjectArgs.builder()
                    .bucket(bucket)
                    .object(objectName)
                    .stream(stream, objectSize, partSize)
                    .userMetadata(userMetadata);
            if (contentType != null) {
                args.contentType(contentType);
            }
            c.putObject(args.build());
        });
    }

    /**
     * 下载对象到本地文件（方法内部会自动关闭流），目标文件已存在时覆盖。
     */
    @Override
    public Mono<Path> downloadFile(StorageConnection conn, String bucket, String objectName, Path destination) {
        return call(conn, "downloadFile", c -> {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (GetObjectResponse in = c.getObject(
                    GetObjectArgs.builder().bucket(bucket).object(objectName).build())) {
                Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
            }
            return destination;
        });
    }

    @Override
    public Mono<InputStream> getObjectStream(StorageConnection conn, String bucket, String objectName) {
        return call(conn, "getObjectStream", c -> (InputStream) c.getObject(
                GetObjectArgs.builder().bucket(bucket).object(objectName).build()));
    }

    @Override
    public Mono<Void> deleteObject(StorageConnection conn, String bucket, String objectName) {
        return run(conn, "deleteObject",
                c -> c.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(objectName).build()));
    }

    /**
     * 一次批量删除请求，逐个名字记账：后端返回的 DeleteError 记为该名字失败；
     * 整个批量请求失败时退化为逐个 removeObject，依然逐条记账。
     */
    @Override
    public Mono<BatchResult> deleteObjects(StorageConnection conn, String bucket, List<String> objectNames) {
        if (conn == null) {
            return Mono.error(new NotConnectedException());
        }
        if (objectNames == null || objectNames.isEmpty()) {
            return Mono.just(BatchResult.empty());
        }
        return call(conn, "deleteObjects", c -> bulkDelete(c, bucket, objectNames))
                .onErrorResume(err -> {
                    log.warn("Bulk delete of {} object(s) in '{}' failed: {}; retrying one by one",
                            objectNames.size(), bucket, err.getMessage());
                    return BatchRunner.runSequentially(objectNames, Function.identity(),
                            name -> deleteObject(conn, bucket, name));
                });
    }

    @Override
    public Mono<Void> copyObject(StorageConnection conn, String sourceBucket, String sourceObject,
                                 String destBucket, String destObject) {
        return run(conn, "copyObject", c -> c.copyObject(CopyObjectArgs.builder()
                .bucket(destBucket)
                .object(destObject)
                .source(CopySource.builder().bucket(sourceBucket).object(sourceObject).build())
                .build()));
    }

    @Override
    public Mono<ObjectInfo> getObjectInfo(StorageConnection conn, String bucket, String objectName) {
        return call(conn, "getObjectInfo", c -> {
            StatObjectResponse stat = c.statObject(
                    StatObjectArgs.builder().bucket(bucket).object(objectName).build());
            return new ObjectInfo(objectName, stat.size(), stat.lastModified(), stripQuotes(stat.etag()),
                    stat.contentType(), false, stat.userMetadata());
        });
    }

    @Override
    public Mono<String> generatePresignedUrl(StorageConnection conn, String bucket, String objectName,
                                             String method, PresignOptions options) {
        if (conn == null) {
            return Mono.error(new NotConnectedException());
        }
        PresignMethod presignMethod;
        try {
            presignMethod = PresignMethod.parse(method);
        } catch (StorageException e) {
            return Mono.error(e);
        }
        PresignOptions opts = options != null ? options : PresignOptions.defaults();
        int expiry = effectiveExpirySeconds(opts, ZonedDateTime.now(ZoneOffset.UTC));

        return call(conn, "generatePresignedUrl", c -> {
            GetPresignedObjectUrlArgs.Builder args = GetPresignedObjectUrlArgs.builder()
                    .method(presignMethod.httpMethod())
                    .bucket(bucket)
                    .object(objectName)
                    .expiry(expiry, TimeUnit.SECONDS);
            if (presignMethod != PresignMethod.PUT && opts.requestParams() != null && !opts.requestParams().isEmpty()) {
                args.extraQueryParams(opts.requestParams());
            }
            return c.getPresignedObjectUrl(args.build());
        });
    }

    /**
     * 有效期：未指定或 ≤0 时用默认值；给了 requestDate 时链接在 requestDate + expires 过期
     * （SDK 总是按当前时间签名，这里折算成剩余秒数）；最终夹到 1s ~ 7d。
     */
    int effectiveExpirySeconds(PresignOptions opts, ZonedDateTime now) {
        long seconds = opts.expires() != null && opts.expires() > 0
                ? opts.expires()
                : props.getPresignExpirySeconds();
        if (opts.requestDate() != null) {
            seconds -= Duration.between(opts.requestDate(), now).getSeconds();
        }
        return (int) Math.min(Math.max(seconds, 1), MAX_PRESIGN_SECONDS);
    }

    // ========= 汇总 =========

    /**
     * 对每个桶做一次全量递归列举再累加，没有缓存，代价与对象总数成正比。
     * 对象很多时请配置 storage.minio.stats-max-objects-per-bucket 限制单桶扫描量。
     */
    @Override
    public Mono<StorageStats> getStorageStats(StorageConnection conn) {
        return listBuckets(conn)
                .flatMapMany(Flux::fromIterable)
                .concatMap(bucket -> call(conn, "getStorageStats", c -> scanBucket(c, bucket.name())))
                .collectList()
                .map(StorageStats::fold);
    }

    @Override
    public Mono<BatchResult> uploadFiles(StorageConnection conn, String bucket, List<UploadItem> items) {
        if (conn == null) {
            return Mono.error(new NotConnectedException());
        }
        return BatchRunner.runSequentially(items, UploadItem::source,
                item -> uploadFile(conn, bucket, item.objectName(), item.source(), item.metadata()));
    }

    @Override
    public Mono<BatchResult> downloadFiles(StorageConnection conn, String bucket, List<DownloadItem> items) {
        if (conn == null) {
            return Mono.error(new NotConnectedException());
        }
        return BatchRunner.runSequentially(items, DownloadItem::objectName,
                item -> downloadFile(conn, bucket, item.objectName(), Path.of(item.localPath())));
    }

    // ========= 策略 =========

    @Override
    public Mono<Void> setBucketPolicy(StorageConnection conn, String bucket, String policyJson) {
        return run(conn, "setBucketPolicy", c -> c.setBucketPolicy(
                SetBucketPolicyArgs.builder().bucket(bucket).config(policyJson == null ? "" : policyJson).build()));
    }

    @Override
    public Mono<String> getBucketPolicy(StorageConnection conn, String bucket) {
        return call(conn, "getBucketPolicy",
                c -> c.getBucketPolicy(GetBucketPolicyArgs.builder().bucket(bucket).build()));
    }

    @Override
    public Mono<Void> deleteBucketPolicy(StorageConnection conn, String bucket) {
        return setBucketPolicy(conn, bucket, "");
    }

    // ========= 工具方法 =========

    private <T> Mono<T> call(StorageConnection conn, String operation, MinioCall<T> call) {
        if (conn == null) {
            return Mono.error(new NotConnectedException());
        }
        return Mono.fromCallable(() -> call.apply(conn.client()))
                .onErrorMap(e -> translate(operation, e))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Void> run(StorageConnection conn, String operation, MinioRun run) {
        return call(conn, operation, c -> {
            run.run(c);
            return Boolean.TRUE;
        }).then();
    }

    static Throwable translate(String operation, Throwable e) {
        if (e instanceof StorageException) {
            return e;
        }
        if (e instanceof ErrorResponseException ere && ere.errorResponse() != null
                && NOT_FOUND_CODES.contains(ere.errorResponse().code())) {
            String detail = ere.errorResponse().message();
            return new StorageNotFoundException(operation + " failed: " + ere.errorResponse().code()
                    + (detail != null ? " - " + detail : ""), e);
        }
        return new BackendException(operation, e);
    }

    private Mono<Void> putFile(StorageConnection conn, String bucket, String objectName, Path file,
                               Map<String, String> metadata) {
        return run(conn, "uploadFile", c -> {
            if (!Files.exists(file)) {
                throw StorageNotFoundException.localFile(file.toString());
            }
            long size = Files.size(file);
            Map<String, String> userMetadata = new LinkedHashMap<>();
            String contentType = splitContentType(metadata, userMetadata);
            if (contentType == null) {
                contentType = detectContentType(file);
            }
            try (InputStream in = Files.newInputStream(file)) {
                c.putObject(PutObjectArgs.builder()
                        .bucket(bucket)
                        .object(objectName)
                        .stream(in, size, -1)
                        .userMetadata(userMetadata)
                        .contentType(contentType)
                        .build());
            }
            log.debug("Uploaded {} ({} bytes, {}) to {}/{}", file, size, contentType, bucket, objectName);
        });
    }

    private BatchResult bulkDelete(MinioClient client, String bucket, List<String> names) throws Exception {
        List<DeleteObject> objects = names.stream().map(DeleteObject::new).toList();
        Map<String, String> failures = new HashMap<>();
        // removeObjects 是惰性的，必须遍历结果才会真正发请求
        for (Result<DeleteError> result : client.removeObjects(
                RemoveObjectsArgs.builder().bucket(bucket).objects(objects).build())) {
            DeleteError error = result.get();
            failures.put(error.objectName(), error.message());
        }
        List<ItemOutcome> outcomes = names.stream()
                .map(name -> failures.containsKey(name)
                        ? ItemOutcome.failed(name, failures.get(name))
                        : ItemOutcome.ok(name))
                .toList();
        return BatchResult.fromOutcomes(outcomes);
    }

    private BucketStats scanBucket(MinioClient client, String bucket) throws Exception {
        long limit = props.getStatsMaxObjectsPerBucket();
        long count = 0;
        long size = 0;
        boolean truncated = false;
        for (Result<Item> result : client.listObjects(listArgs(bucket, null, true))) {
            if (limit > 0 && count >= limit) {
                truncated = true;
                log.warn("Storage stats for bucket '{}' truncated at {} object(s)", bucket, limit);
                break;
            }
            size += result.get().size();
            count++;
        }
        return new BucketStats(bucket, count, size, truncated);
    }

    private static ListObjectsArgs listArgs(String bucket, String prefix, boolean recursive) {
        ListObjectsArgs.Builder args = ListObjectsArgs.builder().bucket(bucket).recursive(recursive);
        if (StringUtils.hasText(prefix)) {
            args.prefix(prefix);
        }
        return args.build();
    }

    private static ObjectInfo toObjectInfo(Item item) {
        String name = item.objectName();
        // 公共前缀条目没有 lastModified
        ZonedDateTime lastModified = item.isDir() ? null : item.lastModified();
        return ObjectInfo.listed(name, item.size(), lastModified, stripQuotes(item.etag()));
    }

    private static String stripQuotes(String etag) {
        return etag == null ? null : etag.replace("\"", "");
    }

    /** 把 metadata 中的 Content-Type（不区分大小写）拆出来，其余写入 userMetadata */
    private static String splitContentType(Map<String, String> metadata, Map<String, String> userMetadata) {
        String contentType = null;
        if (metadata == null) return null;
        for (Map.Entry<String, String> e : metadata.entrySet()) {
            if (e.getKey() != null && CONTENT_TYPE.equalsIgnoreCase(e.getKey())) {
                contentType = e.getValue();
            } else {
                userMetadata.put(e.getKey(), e.getValue());
            }
        }
        return StringUtils.hasText(contentType) ? contentType : null;
    }

    private String detectContentType(Path file) throws IOException {
        String contentType = Files.probeContentType(file);
        if (contentType != null) return contentType;
        return tika.detect(file); // 无法推测时用 Tika
    }
}
