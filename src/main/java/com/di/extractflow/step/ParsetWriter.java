package com.di.extractflow.step;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes a parameter map in the {@code key = value} config-file format the domain binaries read.
 * Nested groups become {@code [section]} headers followed by their entries.
 */
public final class ParsetWriter {

    private ParsetWriter() {}

    public static String render(Map<String, Object> values) {
        StringBuilder sb = new StringBuilder();
        appendEntries(sb, values);
        return sb.toString();
    }

    public static Path write(Map<String, Object> values, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        return Files.writeString(file, render(values), StandardCharsets.UTF_8);
    }

    /** Plain entries first: anything written after a section header belongs to that section. */
    private static void appendEntries(StringBuilder sb, Map<?, ?> values) {
        for (Map.Entry<?, ?> e : values.entrySet()) {
            if (!(e.getValue() instanceof Map<?, ?>)) {
                sb.append(e.getKey()).append(" = ").append(format(e.getValue())).append('\n');
            }
        }
        for (Map.Entry<?, ?> e : values.entrySet()) {
            if (e.getValue() instanceof Map<?, ?> group) {
                sb.append('[').append(e.getKey()).append("]\n");
                appendEntries(sb, group);
            }
        }
    }

    private static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof Iterable<?> list) {
            StringBuilder sb = new StringBuilder("[");
            for (Object item : list) {
                if (sb.length() > 1) sb.append(", ");
                sb.append(format(item));
            }
            return sb.append(']').toString();
        }
        return value.toString();
    }
}
