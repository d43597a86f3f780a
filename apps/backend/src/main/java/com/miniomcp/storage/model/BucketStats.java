package com.miniomcp.storage.model;

/**
 * @param truncated true when the scan stopped at the configured per-bucket object cap
 */
public record BucketStats(String bucketName, long objectCount, long totalSize, boolean truncated) {}
