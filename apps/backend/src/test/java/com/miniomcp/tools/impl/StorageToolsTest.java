package com.miniomcp.tools.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.miniomcp.api.dto.ToolResult;
import com.miniomcp.storage.ConnectionConfig;
import com.miniomcp.storage.ConnectionHolder;
import com.miniomcp.storage.MinioProps;
import com.miniomcp.storage.StorageConnection;
import com.miniomcp.storage.StorageConnector;
import com.miniomcp.storage.StorageService;
import com.miniomcp.storage.exception.StorageNotFoundException;
import com.miniomcp.storage.model.BatchItemError;
import com.miniomcp.storage.model.BatchResult;
import com.miniomcp.storage.model.BucketInfo;
import com.miniomcp.storage.model.DownloadItem;
import com.miniomcp.storage.model.PresignOptions;
import com.miniomcp.storage.model.UploadItem;
import com.miniomcp.tools.AiTool;
import com.miniomcp.tools.ToolRegistry;
import io.minio.MinioClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StorageToolsTest {

    @Mock
    private StorageService storage;

    @Mock
    private StorageConnector connector;

    private ConnectionHolder holder;
    private StorageConnection conn;

    @BeforeEach
    void setUp() {
        holder = new ConnectionHolder(connector);
        conn = new StorageConnection(ConnectionConfig.of("localhost", null, null, "ak", "sk", null),
                mock(MinioClient.class));
    }

    private void connected() {
        when(connector.connect(any(ConnectionConfig.class))).thenReturn(Mono.just(conn));
        holder.connect(conn.config()).block();
    }

    @Test
    void everyToolRegistersWithAnObjectSchema() {
        ToolRegistry registry = new ToolRegistry(allTools());

        assertThat(registry.allTools()).hasSize(19);
        assertThat(registry.allTools()).extracting(AiTool::name).contains(
                "minio_connect", "list_buckets", "create_bucket", "delete_bucket", "bucket_exists",
                "list_objects", "upload_file", "download_file", "delete_object", "delete_objects",
                "copy_object", "get_object_info", "generate_presigned_url", "get_storage_stats",
                "upload_files", "download_files", "set_bucket_policy", "get_bucket_policy",
                "delete_bucket_policy");
    }

    @Test
    void toolsWithoutConnectionReportNotConnected() throws Exception {
        ToolResult result = new ListBucketsTool(storage, holder).execute(Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(errorData(result)).containsEntry("code", "NotConnected");
        assertThat((String) errorData(result).get("text")).contains("list_buckets");
        verifyNoInteractions(storage);
    }

    @Test
    void connectUsesConfiguredDefaultsForMissingFields() throws Exception {
        MinioProps defaults = new MinioProps();
        defaults.setEndpoint("configured.local");
        defaults.setAccessKey("cfg-ak");
        defaults.setSecretKey("cfg-sk");
        when(connector.connect(any(ConnectionConfig.class))).thenReturn(Mono.just(conn));
        when(storage.listBuckets(conn)).thenReturn(Mono.just(List.of(new BucketInfo("a", ZonedDateTime.now()))));

        ToolResult result = new ConnectTool(storage, holder, defaults).execute(Map.of("port", "9100"));

        ArgumentCaptor<ConnectionConfig> captor = ArgumentCaptor.forClass(ConnectionConfig.class);
        verify(connector).connect(captor.capture());
        assertThat(captor.getValue().endpoint()).isEqualTo("configured.local");
        assertThat(captor.getValue().port()).isEqualTo(9100);
        assertThat(captor.getValue().region()).isEqualTo("us-east-1");
        assertThat(result.isSuccess()).isTrue();
        assertThat(data(result)).containsEntry("bucketCount", 1);
        assertThat(holder.require()).isSameAs(conn);
    }

    @Test
    void missingRequiredArgumentIsInvalidArgument() throws Exception {
        connected();

        ToolResult result = new CreateBucketTool(storage, holder).execute(Map.of());

        assertThat(result.status()).isEqualTo(ToolResult.ERROR);
        assertThat(errorData(result)).containsEntry("code", "InvalidArgument");
        verifyNoInteractions(storage);
    }

    @Test
    void storageErrorsBecomeErrorResults() throws Exception {
        connected();
        when(storage.getObjectInfo(conn, "b", "missing"))
                .thenReturn(Mono.error(new StorageNotFoundException("getObjectInfo failed: NoSuchKey")));

        ToolResult result = new GetObjectInfoTool(storage, holder)
                .execute(Map.of("bucketName", "b", "objectName", "missing"));

        assertThat(errorData(result))
                .containsEntry("code", "NotFound")
                .containsEntry("message", "getObjectInfo failed: NoSuchKey");
    }

    @Test
    void deleteObjectsSummarizesFailures() throws Exception {
        connected();
        BatchResult batch = new BatchResult(false, 1, 1, List.of(new BatchItemError("b.txt", "Access Denied")));
        when(storage.deleteObjects(conn, "bucket", List.of("a.txt", "b.txt"))).thenReturn(Mono.just(batch));

        ToolResult result = new DeleteObjectsTool(storage, holder)
                .execute(Map.of("bucketName", "bucket", "objectNames", List.of("a.txt", "b.txt")));

        assertThat(result.isSuccess()).isTrue();
        assertThat(data(result)).containsEntry("result", batch);
        assertThat((String) data(result).get("text")).isEqualTo("Deleted 1 of 2 item(s); 1 failed: b.txt");
    }

    @Test
    void presignPassesOptionsThrough() throws Exception {
        connected();
        when(storage.generatePresignedUrl(eq(conn), eq("b"), eq("o"), eq("put"), any(PresignOptions.class)))
                .thenReturn(Mono.just("https://signed"));

        ToolResult result = new GeneratePresignedUrlTool(storage, holder).execute(Map.of(
                "bucketName", "b", "objectName", "o", "method", "put", "expires", 600,
                "reqParams", Map.of("response-content-type", "text/plain"),
                "requestDate", "2025-01-01T00:00:00Z"));

        ArgumentCaptor<PresignOptions> captor = ArgumentCaptor.forClass(PresignOptions.class);
        verify(storage).generatePresignedUrl(eq(conn), eq("b"), eq("o"), eq("put"), captor.capture());
        assertThat(captor.getValue().expires()).isEqualTo(600);
        assertThat(captor.getValue().requestParams()).containsEntry("response-content-type", "text/plain");
        assertThat(captor.getValue().requestDate().getYear()).isEqualTo(2025);
        assertThat(data(result)).containsEntry("url", "https://signed").containsEntry("method", "PUT");
    }

    @Test
    void presignWithMalformedDateIsInvalidArgument() throws Exception {
        connected();

        ToolResult result = new GeneratePresignedUrlTool(storage, holder).execute(Map.of(
                "bucketName", "b", "objectName", "o", "requestDate", "yesterday"));

        assertThat(errorData(result)).containsEntry("code", "InvalidArgument");
    }

    @Test
    void uploadFilesMapsItems() throws Exception {
        connected();
        when(storage.uploadFiles(eq(conn), eq("bucket"), anyList())).thenReturn(Mono.just(
                new BatchResult(true, 2, 0, List.of())));

        ToolResult result = new UploadFilesTool(storage, holder).execute(Map.of(
                "bucketName", "bucket",
                "files", List.of(
                        Map.of("localPath", "/tmp/a.txt", "objectName", "a.txt"),
                        Map.of("localPath", "https://example.com/b.png", "objectName", "img/b.png",
                                "metadata", Map.of("Content-Type", "image/png")))));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<UploadItem>> captor = ArgumentCaptor.forClass(List.class);
        verify(storage).uploadFiles(eq(conn), eq("bucket"), captor.capture());
        assertThat(captor.getValue()).containsExactly(
                new UploadItem("/tmp/a.txt", "a.txt", null),
                new UploadItem("https://example.com/b.png", "img/b.png", Map.of("Content-Type", "image/png")));
        assertThat((String) data(result).get("text")).isEqualTo("Uploaded 2 of 2 item(s).");
    }

    @Test
    void downloadFilesRejectsNonObjectItems() throws Exception {
        connected();

        ToolResult result = new DownloadFilesTool(storage, holder)
                .execute(Map.of("bucketName", "bucket", "files", List.of("not-an-object")));

        assertThat(errorData(result)).containsEntry("code", "InvalidArgument");
        verify(storage, never()).downloadFiles(any(), any(), anyList());
    }

    @Test
    void downloadFilesMapsItems() throws Exception {
        connected();
        when(storage.downloadFiles(eq(conn), eq("bucket"), anyList())).thenReturn(Mono.just(
                new BatchResult(true, 1, 0, List.of())));

        new DownloadFilesTool(storage, holder).execute(Map.of(
                "bucketName", "bucket",
                "files", List.of(Map.of("objectName", "a.txt", "localPath", "/tmp/out/a.txt"))));

        verify(storage).downloadFiles(conn, "bucket", List.of(new DownloadItem("a.txt", "/tmp/out/a.txt")));
    }

    @Test
    void setBucketPolicyAcceptsObjectPolicy() throws Exception {
        connected();
        when(storage.setBucketPolicy(eq(conn), eq("bucket"), any())).thenReturn(Mono.empty());
        Map<String, Object> policy = Map.of("Version", "2012-10-17", "Statement", List.of());

        ToolResult result = new SetBucketPolicyTool(storage, holder, new ObjectMapper())
                .execute(Map.of("bucketName", "bucket", "policy", policy));

        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(storage).setBucketPolicy(eq(conn), eq("bucket"), captor.capture());
        assertThat(new ObjectMapper().readValue(captor.getValue(), Map.class)).isEqualTo(policy);
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void getBucketPolicyReportsMissingPolicy() throws Exception {
        connected();
        when(storage.getBucketPolicy(conn, "bucket")).thenReturn(Mono.just(""));

        ToolResult result = new GetBucketPolicyTool(storage, holder).execute(Map.of("bucketName", "bucket"));

        assertThat((String) data(result).get("text")).isEqualTo("Bucket 'bucket' has no policy.");
    }

    @Test
    void listObjectsPassesPrefixAndRecursiveFlag() throws Exception {
        connected();
        when(storage.listObjects(conn, "bucket", "logs/", true)).thenReturn(Mono.just(List.of()));

        ToolResult result = new ListObjectsTool(storage, holder)
                .execute(Map.of("bucketName", "bucket", "prefix", "logs/", "recursive", "true"));

        assertThat(data(result)).containsEntry("count", 0);
    }

    @Test
    void createBucketWithoutRegionPassesNull() throws Exception {
        connected();
        when(storage.createBucket(eq(conn), eq("new-bucket"), isNull())).thenReturn(Mono.empty());

        ToolResult result = new CreateBucketTool(storage, holder).execute(Map.of("bucketName", "new-bucket"));

        assertThat(result.isSuccess()).isTrue();
    }

    private List<AiTool> allTools() {
        return List.of(
                new ConnectTool(storage, holder, new MinioProps()),
                new ListBucketsTool(storage, holder),
                new CreateBucketTool(storage, holder),
                new DeleteBucketTool(storage, holder),
                new BucketExistsTool(storage, holder),
                new ListObjectsTool(storage, holder),
                new UploadFileTool(storage, holder),
                new DownloadFileTool(storage, holder),
                new DeleteObjectTool(storage, holder),
                new DeleteObjectsTool(storage, holder),
                new CopyObjectTool(storage, holder),
                new GetObjectInfoTool(storage, holder),
                new GeneratePresignedUrlTool(storage, holder),
                new GetStorageStatsTool(storage, holder),
                new UploadFilesTool(storage, holder),
                new DownloadFilesTool(storage, holder),
                new SetBucketPolicyTool(storage, holder, new ObjectMapper()),
                new GetBucketPolicyTool(storage, holder),
                new DeleteBucketPolicyTool(storage, holder));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ToolResult result) {
        return (Map<String, Object>) result.data();
    }

    private static Map<String, Object> errorData(ToolResult result) {
        assertThat(result.status()).isEqualTo(ToolResult.ERROR);
        return data(result);
    }
}
