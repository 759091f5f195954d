package com.di.extractflow.partition;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Slices a time-sorted row sequence into {@code N} equal-duration windows.
 *
 * <p>With {@code chunk = (t[last] - t[first]) / N} and {@code start = t[first]}, window {@code i}
 * covers {@code [lowerBound(start), lowerBound(start + chunk))}; the last window always ends at
 * the row count. Windows are contiguous, disjoint and cover every row; a window may be empty.
 */
@Slf4j
public final class PartitionBoundaryCalculator {

    private PartitionBoundaryCalculator() {}

    /**
     * @param sortedTimes time column, ascending
     * @throws IllegalArgumentException if {@code partitionCount <= 0}
     */
    public static List<Partition> computePartitions(double[] sortedTimes, int partitionCount, String source) {
        if (partitionCount <= 0) throw new IllegalArgumentException("partitionCount must be > 0");

        int totalRows = sortedTimes.length;
        List<Partition> partitions = new ArrayList<>(partitionCount);
        if (totalRows == 0) {
            for (int i = 0; i < partitionCount; i++) {
                partitions.add(new Partition(i, 0, 0, source));
            }
            return partitions;
        }

        double chunk = (sortedTimes[totalRows - 1] - sortedTimes[0]) / partitionCount;
        double startTime = sortedTimes[0];
        for (int i = 0; i < partitionCount; i++) {
            double endTime = startTime + chunk;
            int startIndex = lowerBound(sortedTimes, startTime);
            int endIndex = (i == partitionCount - 1) ? totalRows : lowerBound(sortedTimes, endTime);
            partitions.add(new Partition(i, startIndex, Math.max(startIndex, endIndex), source));
            startTime = endTime;
        }
        log.debug("[PARTITION-BOUNDS] rows={} chunk={} → {}", totalRows, chunk, partitions);
        return partitions;
    }

    /** First index whose value is {@code >= key}; {@code values.length} if none. */
    static int lowerBound(double[] values, double key) {
        int lo = 0;
        int hi = values.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (values[mid] < key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
