package com.di.extractflow.storage;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Minimal object storage surface the pipeline depends on. Keys are {@code /}-separated.
 * Every failure surfaces as {@link com.di.extractflow.exception.ObjectStorageException}.
 */
public interface ObjectStorageClient {

    /** Keys under {@code prefix}, sorted lexicographically. */
    List<String> listKeys(String container, String prefix);

    /** Writes the object to {@code target} (parent directories created) and returns its size in bytes. */
    long get(String container, String key, Path target);

    void put(String container, String key, Path source);

    Optional<ObjectHead> head(String container, String key);
}
