package com.di.extractflow.config;

import com.di.extractflow.storage.GcsObjectStorageClient;
import com.di.extractflow.storage.LocalObjectStorageClient;
import com.di.extractflow.storage.ObjectStorageClient;
import com.di.extractflow.storage.StorageTransfer;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Object storage wiring. {@code extractflow.storage.type} selects the backend:
 * {@code gcs} (Application Default Credentials) or {@code local} (a directory per container).
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnMissingBean(Storage.class)
    @ConditionalOnProperty(name = "extractflow.storage.type", havingValue = "gcs")
    public Storage gcsStorage() {
        return StorageOptions.getDefaultInstance().getService();
    }

    @Bean
    @ConditionalOnMissingBean(ObjectStorageClient.class)
    public ObjectStorageClient objectStorageClient(ExtractFlowProperties properties, ObjectProvider<Storage> storage) {
        String type = properties.getStorage().getType();
        return switch (type) {
            case "gcs" -> {
                log.info("[STORAGE] using Google Cloud Storage");
                yield new GcsObjectStorageClient(storage.getObject());
            }
            case "local" -> {
                log.info("[STORAGE] using local storage rooted at {}", properties.getStorage().getLocalRoot());
                yield new LocalObjectStorageClient(Paths.get(properties.getStorage().getLocalRoot()));
            }
            default -> throw new IllegalStateException("Unknown extractflow.storage.type '" + type + "' (expected gcs or local)");
        };
    }

    @Bean
    public StorageTransfer storageTransfer(ObjectStorageClient client, ExtractFlowProperties properties) {
        return new StorageTransfer(client, properties.getTransfer().getMaxConcurrent(),
                properties.getExecutor().getResultTimeout());
    }
}
