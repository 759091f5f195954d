package com.di.extractflow.partition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PartitionBoundaryCalculator Tests")
class PartitionBoundaryCalculatorTest {

    private static double[] sequence(int n) {
        return IntStream.range(0, n).mapToDouble(i -> i).toArray();
    }

    @Test
    @DisplayName("1000 evenly spaced rows in 4 partitions give 250-row windows")
    void testEvenSplit() {
        List<Partition> parts = PartitionBoundaryCalculator.computePartitions(sequence(1000), 4, "ds");

        assertEquals(4, parts.size());
        assertEquals(new Partition(0, 0, 250, "ds"), parts.get(0));
        assertEquals(new Partition(1, 250, 500, "ds"), parts.get(1));
        assertEquals(new Partition(2, 500, 750, "ds"), parts.get(2));
        assertEquals(new Partition(3, 750, 1000, "ds"), parts.get(3));
    }

    @ParameterizedTest(name = "rows={0} partitions={1}")
    @CsvSource({"1, 1", "1, 5", "7, 3", "100, 7", "1000, 13", "37, 37", "5, 9"})
    @DisplayName("Partitions are contiguous, disjoint and cover every row")
    void testCoverage(int rows, int n) {
        List<Partition> parts = PartitionBoundaryCalculator.computePartitions(sequence(rows), n, "ds");

        assertEquals(n, parts.size());
        assertEquals(0, parts.get(0).startRow());
        for (int i = 1; i < n; i++) {
            assertEquals(parts.get(i - 1).endRow(), parts.get(i).startRow(), "gap or overlap at " + i);
            assertTrue(parts.get(i).rowCount() >= 0);
        }
        assertEquals(rows, parts.get(n - 1).endRow());
        assertEquals(rows, parts.stream().mapToInt(Partition::rowCount).sum());
    }

    @Test
    @DisplayName("Duplicate timestamps never straddle a boundary")
    void testDuplicateTimes() {
        double[] times = {0, 0, 0, 1, 1, 2, 2, 2, 3, 4};
        List<Partition> parts = PartitionBoundaryCalculator.computePartitions(times, 2, "ds");

        assertEquals(5, parts.get(0).endRow());
        assertEquals(10, parts.get(1).endRow());
    }

    @Test
    @DisplayName("Identical timestamps put every row in the last partition")
    void testZeroSpan() {
        List<Partition> parts = PartitionBoundaryCalculator.computePartitions(new double[]{5, 5, 5}, 3, "ds");

        assertEquals(0, parts.get(0).rowCount());
        assertEquals(0, parts.get(1).rowCount());
        assertEquals(3, parts.get(2).rowCount());
    }

    @Test
    @DisplayName("An empty source yields N empty partitions")
    void testEmpty() {
        List<Partition> parts = PartitionBoundaryCalculator.computePartitions(new double[0], 3, "ds");
        assertEquals(3, parts.size());
        assertTrue(parts.stream().allMatch(p -> p.rowCount() == 0));
    }

    @Test
    @DisplayName("Should reject a non-positive partition count")
    void testInvalidCount() {
        assertThrows(IllegalArgumentException.class,
                () -> PartitionBoundaryCalculator.computePartitions(sequence(10), 0, "ds"));
    }

    @Test
    @DisplayName("lowerBound returns the first index not less than the key")
    void testLowerBound() {
        double[] values = {1, 2, 2, 4};
        assertEquals(0, PartitionBoundaryCalculator.lowerBound(values, 0.5));
        assertEquals(1, PartitionBoundaryCalculator.lowerBound(values, 2));
        assertEquals(3, PartitionBoundaryCalculator.lowerBound(values, 3));
        assertEquals(4, PartitionBoundaryCalculator.lowerBound(values, 5));
    }
}
