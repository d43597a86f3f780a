package com.miniomcp.storage.model;

public record DownloadItem(String objectName, String localPath) {}
