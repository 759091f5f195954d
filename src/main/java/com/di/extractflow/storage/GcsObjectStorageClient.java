package com.di.extractflow.storage;

import com.di.extractflow.exception.ObjectStorageException;
import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link ObjectStorageClient} over Google Cloud Storage; the container is the bucket name.
 */
@Slf4j
@RequiredArgsConstructor
public class GcsObjectStorageClient implements ObjectStorageClient {

    private final Storage storage;

    @Override
    public List<String> listKeys(String bucket, String prefix) {
        try {
            Page<Blob> page = storage.list(bucket, Storage.BlobListOption.prefix(prefix));
            List<String> keys = new ArrayList<>();
            for (Blob blob : page.iterateAll()) {
                keys.add(blob.getName());
            }
            Collections.sort(keys);
            return keys;
        } catch (StorageException e) {
            throw new ObjectStorageException("Failed to list gs://" + bucket + "/" + prefix, e);
        }
    }

    @Override
    public long get(String bucket, String key, Path target) {
        String gcsPath = "gs://" + bucket + "/" + key;
        try {
            Blob blob = storage.get(BlobId.of(bucket, key));
            if (blob == null) {
                throw new ObjectStorageException("No such object " + gcsPath);
            }
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            blob.downloadTo(target);
            long size = Files.size(target);
            log.debug("[GCS] downloaded {} ({} bytes) → {}", gcsPath, size, target);
            return size;
        } catch (StorageException | IOException e) {
            throw new ObjectStorageException("Failed to download " + gcsPath, e);
        }
    }

    @Override
    public void put(String bucket, String key, Path source) {
        String gcsPath = "gs://" + bucket + "/" + key;
        try {
            BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket, key)).build();
            storage.createFrom(blobInfo, source);
            log.debug("[GCS] uploaded {} → {}", source, gcsPath);
        } catch (StorageException | IOException e) {
            throw new ObjectStorageException("Failed to upload " + source + " to " + gcsPath, e);
        }
    }

    @Override
    public Optional<ObjectHead> head(String bucket, String key) {
        try {
            Blob blob = storage.get(BlobId.of(bucket, key));
            if (blob == null || blob.getSize() == null) {
                return Optional.empty();
            }
            return Optional.of(new ObjectHead(bucket, key, blob.getSize()));
        } catch (StorageException e) {
            throw new ObjectStorageException("Failed to head gs://" + bucket + "/" + key, e);
        }
    }
}
