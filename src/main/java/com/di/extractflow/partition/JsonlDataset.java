package com.di.extractflow.partition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A tabular dataset directory: a row file with one JSON object per line, plus any metadata files
 * next to it. Rows are kept as their raw JSON text so partitions reproduce them byte for byte.
 */
@Getter
public class JsonlDataset {

    /** One row; {@code time} is the parsed value of the time column. */
    public record Row(double time, String json) {}

    private final String name;
    private final Path directory;
    private final List<Row> rows;
    private final Set<String> columns;
    /** Paths of all non-row files, relative to {@link #directory}. */
    private final List<Path> metadataFiles;

    private JsonlDataset(String name, Path directory, List<Row> rows, Set<String> columns, List<Path> metadataFiles) {
        this.name = name;
        this.directory = directory;
        this.rows = rows;
        this.columns = columns;
        this.metadataFiles = metadataFiles;
    }

    /**
     * @throws IllegalArgumentException when a row lacks a numeric {@code timeColumn}
     */
    public static JsonlDataset load(String name, Path directory, String tableFile, String timeColumn,
                                    ObjectMapper mapper) throws IOException {
        Path table = directory.resolve(tableFile);
        if (!Files.isRegularFile(table)) {
            throw new IOException("Dataset " + name + " has no " + tableFile);
        }
        List<Row> rows = new ArrayList<>();
        Set<String> columns = new LinkedHashSet<>();
        try (BufferedReader reader = Files.newBufferedReader(table, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                JsonNode node = mapper.readTree(line);
                JsonNode time = node.get(timeColumn);
                if (time == null || !time.isNumber()) {
                    throw new IllegalArgumentException(String.format(
                            "Dataset %s line %d: missing numeric column '%s'", name, lineNo, timeColumn));
                }
                for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                    columns.add(it.next());
                }
                rows.add(new Row(time.asDouble(), line));
            }
        }

        List<Path> metadata;
        try (Stream<Path> walk = Files.walk(directory)) {
            metadata = walk.filter(Files::isRegularFile)
                    .map(directory::relativize)
                    .filter(p -> !p.toString().equals(tableFile))
                    .sorted()
                    .collect(Collectors.toList());
        }
        return new JsonlDataset(name, directory, rows, columns, metadata);
    }

    /**
     * Writes {@code rows[startRow, endRow)} as {@code tableFile} under {@code target} and copies this
     * dataset's metadata files next to it.
     */
    public static void writePartition(List<Row> rows, int startRow, int endRow, JsonlDataset metadataSource,
                                      Path target, String tableFile) throws IOException {
        Files.createDirectories(target);
        try (BufferedWriter writer = Files.newBufferedWriter(target.resolve(tableFile), StandardCharsets.UTF_8)) {
            for (int i = startRow; i < endRow; i++) {
                writer.write(rows.get(i).json());
                writer.newLine();
            }
        }
        if (metadataSource == null) {
            return;
        }
        for (Path rel : metadataSource.getMetadataFiles()) {
            Path out = target.resolve(rel.toString());
            Files.createDirectories(out.getParent());
            Files.copy(metadataSource.getDirectory().resolve(rel), out, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
