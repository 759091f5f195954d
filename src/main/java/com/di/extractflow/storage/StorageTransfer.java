package com.di.extractflow.storage;

import com.di.extractflow.exception.ObjectStorageException;
import com.di.extractflow.exception.ParallelPhaseException;
import com.di.extractflow.util.BoundedParallel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded-concurrency downloads and uploads on top of an {@link ObjectStorageClient}.
 *
 * <p>A key that names an object is transferred as one file; a key that names a prefix is
 * transferred object by object on the pool, preserving the layout below the prefix.
 * Per-file failures do not cancel siblings and are reported together as a
 * {@link ParallelPhaseException} once every transfer finished.
 */
@Slf4j
public class StorageTransfer {

    @Getter
    private final ObjectStorageClient client;
    private final int maxConcurrent;
    private final Duration timeout;

    public StorageTransfer(ObjectStorageClient client, int maxConcurrent, Duration timeout) {
        this.client = client;
        this.maxConcurrent = maxConcurrent;
        this.timeout = timeout;
    }

    /**
     * @return total bytes written below {@code localPath}
     */
    public long download(String container, String key, Path localPath) {
        if (client.head(container, key).isPresent()) {
            return client.get(container, key, localPath);
        }

        String prefix = key.endsWith("/") ? key : key + "/";
        List<String> keys = client.listKeys(container, prefix).stream()
                .filter(k -> !k.endsWith("/"))
                .toList();
        if (keys.isEmpty()) {
            throw new ObjectStorageException("Nothing stored at " + container + "/" + key);
        }

        AtomicLong bytes = new AtomicLong();
        BoundedParallel.runAll("download", keys, maxConcurrent, timeout, k -> k,
                k -> bytes.addAndGet(client.get(container, k, localPath.resolve(k.substring(prefix.length())))));
        log.debug("[TRANSFER] downloaded {} object(s) / {} bytes from {}/{}", keys.size(), bytes.get(), container, prefix);
        return bytes.get();
    }

    public void upload(String container, String key, Path file) {
        client.put(container, key, file);
        log.debug("[TRANSFER] uploaded {} → {}/{}", file, container, key);
    }
}
