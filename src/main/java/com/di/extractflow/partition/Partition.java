package com.di.extractflow.partition;

/**
 * Contiguous row range {@code [startRow, endRow)} of the time-sorted source.
 */
public record Partition(int index, int startRow, int endRow, String source) {

    public int rowCount() {
        return endRow - startRow;
    }

    /** {@code partition_<index>.<extension>}: directory name and archive root of this partition. */
    public String directoryName(String extension) {
        return "partition_" + index + "." + extension;
    }
}
