package com.di.extractflow.partition;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Content identifier of a partitioning request: MD5 over total rows, total columns, requested
 * partition count and the constituent dataset names. Equal inputs map to the same storage
 * location, which is what makes re-partitioning a no-op.
 */
public final class DatasetIdentifier {

    private DatasetIdentifier() {}

    public static String compute(long totalRows, int totalColumns, int partitionCount, List<String> datasetNames) {
        String material = totalRows + "|" + totalColumns + "|" + partitionCount + "|" + String.join(",", datasetNames);
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
