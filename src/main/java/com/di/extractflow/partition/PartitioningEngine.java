package com.di.extractflow.partition;

import com.di.extractflow.config.ExtractFlowProperties;
import com.di.extractflow.exception.ObjectStorageException;
import com.di.extractflow.exception.PartitionIdentifierCollisionException;
import com.di.extractflow.reference.ReferencePath;
import com.di.extractflow.reference.ReferenceResolver;
import com.di.extractflow.storage.ObjectStorageClient;
import com.di.extractflow.storage.StorageTransfer;
import com.di.extractflow.util.ArchiveUtils;
import com.di.extractflow.util.BoundedParallel;
import com.di.extractflow.util.PipelineMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Splits a set of source datasets into {@code N} time-windowed partition archives.
 *
 * <h3>Flow</h3>
 * <pre>
 *   1. download + unzip every source archive under the source prefix (bounded pool)
 *   2. concatenate rows, stable sort by time
 *   3. identifier = MD5(rows, columns, N, dataset names)
 *   4. objects under destination/identifier/ ?  → return them (created=false)
 *   5. boundaries → one task per partition (bounded pool):
 *        write rows + metadata → archive (STORED) → upload → delete local copies
 * </pre>
 *
 * A failed partition task does not cancel its siblings; failures are reported together once
 * every task finished.
 */
@Slf4j
public class PartitioningEngine {

    private final StorageTransfer transfer;
    private final ExtractFlowProperties properties;
    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;

    public PartitioningEngine(StorageTransfer transfer, ExtractFlowProperties properties,
                              ObjectMapper objectMapper, PipelineMetrics metrics) {
        this.transfer = transfer;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /* ------------------------------------------------------------------ */
    /* Public API                                                           */
    /* ------------------------------------------------------------------ */

    /**
     * @param source      prefix holding the source dataset archives ({@code *.zip})
     * @param partitionCount requested number of partitions, {@code > 0}
     * @param destination prefix below which {@code <identifier>/partition_<i>.<ext>.zip} is written
     * @throws PartitionIdentifierCollisionException when the identifier's location holds unexpected objects
     */
    public PartitionResult partition(ReferencePath source, int partitionCount, ReferencePath destination) {
        if (partitionCount <= 0) throw new IllegalArgumentException("partitionCount must be > 0");

        Path scratch = Paths.get(properties.getWorkDir(), "partitioning", UUID.randomUUID().toString());
        try {
            List<JsonlDataset> datasets = fetchDatasets(source, scratch.resolve("input"));
            return partitionDatasets(datasets, partitionCount, destination, scratch.resolve("output"));
        } catch (IOException e) {
            throw new UncheckedIOException("Partitioning " + source + " failed", e);
        } finally {
            try {
                ArchiveUtils.deleteRecursively(scratch);
            } catch (IOException e) {
                log.warn("[PARTITION] could not clean up {}: {}", scratch, e.getMessage());
            }
        }
    }

    /* ------------------------------------------------------------------ */
    /* Private: fetch + read                                                */
    /* ------------------------------------------------------------------ */

    private List<JsonlDataset> fetchDatasets(ReferencePath source, Path inputDir) throws IOException {
        ObjectStorageClient client = transfer.getClient();
        String prefix = source.fullKey();
        List<String> archives = client.listKeys(source.getContainer(), prefix).stream()
                .filter(k -> k.endsWith(ArchiveUtils.ZIP_SUFFIX))
                .toList();
        if (archives.isEmpty()) {
            throw new ObjectStorageException("No dataset archives under " + source.getContainer() + "/" + prefix);
        }
        log.info("[PARTITION] fetching {} dataset archive(s) from {}/{}", archives.size(), source.getContainer(), prefix);

        ConcurrentMap<String, Path> extracted = new ConcurrentHashMap<>();
        BoundedParallel.runAll("partition-fetch", archives, properties.getTransfer().getMaxConcurrent(),
                properties.getExecutor().getResultTimeout(), k -> k, key -> {
                    String fileName = ReferenceResolver.lastSegment(key);
                    Path zip = inputDir.resolve(fileName);
                    transfer.download(source.getContainer(), key, zip);
                    try {
                        extracted.put(key, ArchiveUtils.unzip(zip));
                    } catch (IOException e) {
                        throw new UncheckedIOException("Cannot extract " + key, e);
                    }
                });

        List<JsonlDataset> datasets = new ArrayList<>(archives.size());
        for (String key : archives) {
            String fileName = ReferenceResolver.lastSegment(key);
            String name = fileName.substring(0, fileName.length() - ArchiveUtils.ZIP_SUFFIX.length());
            datasets.add(JsonlDataset.load(name, extracted.get(key),
                    properties.getPartition().getTableFile(), properties.getTimeColumn(), objectMapper));
        }
        return datasets;
    }

    /* ------------------------------------------------------------------ */
    /* Private: identify, check cache, create                               */
    /* ------------------------------------------------------------------ */

    private PartitionResult partitionDatasets(List<JsonlDataset> datasets, int partitionCount,
                                              ReferencePath destination, Path outputDir) {
        List<JsonlDataset.Row> rows = new ArrayList<>();
        Set<String> columns = new LinkedHashSet<>();
        List<String> names = new ArrayList<>();
        for (JsonlDataset ds : datasets) {
            rows.addAll(ds.getRows());
            columns.addAll(ds.getColumns());
            names.add(ds.getName());
        }
        rows.sort(Comparator.comparingDouble(JsonlDataset.Row::time));

        String identifier = DatasetIdentifier.compute(rows.size(), columns.size(), partitionCount, names);
        String container = destination.getContainer();
        String location = trimSlash(destination.fullKey()) + "/" + identifier + "/";
        String extension = properties.getPartition().getExtension();

        double[] times = rows.stream().mapToDouble(JsonlDataset.Row::time).toArray();
        List<Partition> partitions = PartitionBoundaryCalculator.computePartitions(times, partitionCount, String.join(",", names));

        List<String> existing = transfer.getClient().listKeys(container, location);
        if (!existing.isEmpty()) {
            List<PartitionArtifact> artifacts = verifyExisting(container, location, extension, partitions, existing);
            log.info("[PARTITION] {} partition(s) already present at {}/{}; skipping", artifacts.size(), container, location);
            if (metrics != null) metrics.recordPartitionCacheHit();
            return result(container, location, identifier, false, rows.size(), columns.size(), artifacts);
        }

        log.info("[PARTITION] rows={} columns={} datasets={} → {} partition(s) at {}/{}",
                 rows.size(), columns.size(), names, partitionCount, container, location);

        JsonlDataset metadataSource = datasets.get(0);
        ConcurrentMap<Integer, PartitionArtifact> created = new ConcurrentHashMap<>();
        BoundedParallel.runAll("partition-create", partitions, properties.getPartition().getMaxConcurrent(),
                properties.getExecutor().getResultTimeout(), p -> "partition-" + p.index(),
                p -> created.put(p.index(), createPartition(p, rows, metadataSource, outputDir, container, location, extension)));

        List<PartitionArtifact> artifacts = new ArrayList<>(created.values());
        artifacts.sort(Comparator.comparingInt(a -> a.partition().index()));
        if (metrics != null) metrics.recordPartitionsCreated(artifacts.size());
        return result(container, location, identifier, true, rows.size(), columns.size(), artifacts);
    }

    private PartitionArtifact createPartition(Partition partition, List<JsonlDataset.Row> rows, JsonlDataset metadataSource,
                                              Path outputDir, String container, String location, String extension) {
        String dirName = partition.directoryName(extension);
        Path dir = outputDir.resolve(dirName);
        String key = location + dirName + ArchiveUtils.ZIP_SUFFIX;
        long startMs = System.currentTimeMillis();
        Path zip = null;
        try {
            JsonlDataset.writePartition(rows, partition.startRow(), partition.endRow(), metadataSource,
                    dir, properties.getPartition().getTableFile());
            zip = ArchiveUtils.zipWithoutCompression(dir);
            long size = Files.size(zip);
            transfer.upload(container, key, zip);
            log.info("[PARTITION] {} rows=[{},{}) size={}B duration={}ms",
                     dirName, partition.startRow(), partition.endRow(), size, System.currentTimeMillis() - startMs);
            return new PartitionArtifact(partition, key, size);
        } catch (IOException e) {
            throw new UncheckedIOException("Partition " + partition.index() + " failed", e);
        } finally {
            deleteLocal(dir);
            if (zip != null) deleteLocal(zip);
        }
    }

    private List<PartitionArtifact> verifyExisting(String container, String location, String extension,
                                                   List<Partition> partitions, List<String> existing) {
        Set<String> expected = new HashSet<>();
        for (Partition p : partitions) {
            expected.add(location + p.directoryName(extension) + ArchiveUtils.ZIP_SUFFIX);
        }
        Set<String> found = new HashSet<>(existing);
        if (!found.equals(expected)) {
            List<String> unexpected = existing.stream().filter(k -> !expected.contains(k)).sorted().toList();
            throw new PartitionIdentifierCollisionException(container + "/" + location, partitions.size(), existing,
                    unexpected.isEmpty() ? List.of("(missing archives)") : unexpected);
        }
        List<PartitionArtifact> artifacts = new ArrayList<>(partitions.size());
        for (Partition p : partitions) {
            String key = location + p.directoryName(extension) + ArchiveUtils.ZIP_SUFFIX;
            long size = transfer.getClient().head(container, key)
                    .orElseThrow(() -> new ObjectStorageException("Vanished while checking: " + key))
                    .sizeBytes();
            artifacts.add(new PartitionArtifact(p, key, size));
        }
        return artifacts;
    }

    private static PartitionResult result(String container, String location, String identifier, boolean created,
                                          long rows, int columns, List<PartitionArtifact> artifacts) {
        return PartitionResult.builder()
                .container(container)
                .location(location)
                .identifier(identifier)
                .created(created)
                .totalRows(rows)
                .totalColumns(columns)
                .partitions(List.copyOf(artifacts))
                .build();
    }

    private static String trimSlash(String key) {
        return key.endsWith("/") ? key.substring(0, key.length() - 1) : key;
    }

    private static void deleteLocal(Path path) {
        try {
            ArchiveUtils.deleteRecursively(path);
        } catch (IOException e) {
            log.warn("[PARTITION] could not delete local copy {}: {}", path, e.getMessage());
        }
    }
}
