package com.miniomcp.storage.model;

import java.util.List;

public record StorageStats(
        int totalBuckets,
        long totalObjects,
        long totalSize,
        List<BucketStats> bucketStats
) {
    public static StorageStats fold(List<BucketStats> perBucket) {
        long objects = 0;
        long size = 0;
        for (BucketStats s : perBucket) {
            objects += s.objectCount();
            size += s.totalSize();
        }
        return new StorageStats(perBucket.size(), objects, size, List.copyOf(perBucket));
    }
}
