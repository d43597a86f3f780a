package com.miniomcp.storage.model;

import java.time.ZonedDateTime;

public record BucketInfo(String name, ZonedDateTime creationDate) {}
