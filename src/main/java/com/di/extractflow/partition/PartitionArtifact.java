package com.di.extractflow.partition;

/**
 * A partition archive as stored in object storage.
 */
public record PartitionArtifact(Partition partition, String key, long sizeBytes) {}
