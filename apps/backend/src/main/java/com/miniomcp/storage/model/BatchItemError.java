package com.miniomcp.storage.model;

public record BatchItemError(String item, String error) {}
