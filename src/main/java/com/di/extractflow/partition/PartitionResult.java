package com.di.extractflow.partition;

import com.di.extractflow.reference.ReferencePath;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of {@link PartitioningEngine#partition}.
 */
@Value
@Builder
public class PartitionResult {

    String container;

    /** Prefix holding the archives: {@code <destination>/<identifier>/}. */
    String location;

    String identifier;

    /** False when the archives already existed and nothing was produced. */
    boolean created;

    long totalRows;
    int totalColumns;

    List<PartitionArtifact> partitions;

    public long totalBytes() {
        return partitions.stream().mapToLong(PartitionArtifact::sizeBytes).sum();
    }

    /** Reference to {@link #location} suitable as a step's designated input. */
    public ReferencePath asInput() {
        return ReferencePath.input(container, location);
    }
}
