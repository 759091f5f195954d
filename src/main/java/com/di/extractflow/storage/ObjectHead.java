package com.di.extractflow.storage;

public record ObjectHead(String container, String key, long sizeBytes) {}
