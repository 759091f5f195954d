package com.di.extractflow.aggregation;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Loads and rewrites the persisted {@link JobCollection} wholesale. Writes go to a sibling temp
 * file that is then moved over the target, so readers never see a half-written document.
 */
@Slf4j
@RequiredArgsConstructor
public class JobCollectionStore {

    private final Path file;
    private final ObjectMapper objectMapper;

    /** Empty collection when the file does not exist yet. */
    public synchronized JobCollection load() {
        if (!Files.exists(file)) {
            return new JobCollection();
        }
        try {
            return objectMapper.readValue(file.toFile(), JobCollection.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read job collection " + file, e);
        }
    }

    public synchronized void save(JobCollection collection) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), collection);
                try {
                    Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    log.debug("[AGGREGATE] atomic move unsupported for {}, replacing", file);
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write job collection " + file, e);
        }
        log.info("[AGGREGATE] saved {} completed step(s) to {}", collection.size(), file);
    }

    /** Load, append, save. */
    public synchronized JobCollection record(CompletedStep step) {
        JobCollection collection = load();
        collection.add(step);
        save(collection);
        return collection;
    }
}
