package com.di.extractflow.storage;

import com.di.extractflow.exception.ObjectStorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link ObjectStorageClient} over a local directory: {@code <root>/<container>/<key>}.
 * Used for single-node runs and as the storage backend in tests.
 */
@Slf4j
public class LocalObjectStorageClient implements ObjectStorageClient {

    private final Path root;

    public LocalObjectStorageClient(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public List<String> listKeys(String container, String prefix) {
        Path base = root.resolve(container);
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(base)) {
            return walk.filter(Files::isRegularFile)
                    .map(p -> base.relativize(p).toString().replace('\\', '/'))
                    .filter(k -> k.startsWith(prefix))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ObjectStorageException("Failed to list " + container + "/" + prefix, e);
        }
    }

    @Override
    public long get(String container, String key, Path target) {
        Path source = resolve(container, key);
        if (!Files.isRegularFile(source)) {
            throw new ObjectStorageException("No such object " + container + "/" + key);
        }
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            return Files.size(target);
        } catch (IOException e) {
            throw new ObjectStorageException("Failed to get " + container + "/" + key, e);
        }
    }

    @Override
    public void put(String container, String key, Path source) {
        Path target = resolve(container, key);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("[LOCAL-STORAGE] {} → {}", source, target);
        } catch (IOException e) {
            throw new ObjectStorageException("Failed to put " + container + "/" + key, e);
        }
    }

    @Override
    public Optional<ObjectHead> head(String container, String key) {
        Path path = resolve(container, key);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ObjectHead(container, key, Files.size(path)));
        } catch (IOException e) {
            throw new ObjectStorageException("Failed to head " + container + "/" + key, e);
        }
    }

    private Path resolve(String container, String key) {
        Path base = root.resolve(container).normalize();
        Path path = base.resolve(key).normalize();
        if (!path.startsWith(base)) {
            throw new ObjectStorageException("Key escapes container: " + key);
        }
        return path;
    }
}
