package com.di.extractflow.reference;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure functions that turn declarative references into per-partition ones.
 *
 * <p>For a partition whose listed key ends in {@code partition_3.ms.zip}:
 * <ul>
 *   <li>the designated input becomes {@code <its prefix>/partition_3.ms.zip}</li>
 *   <li>an output {@code out/ms} with extension {@code ms} becomes {@code out/ms/partition_3.ms}</li>
 *   <li>a dynamic input {@code cal/h5} with extension {@code h5} becomes the input {@code cal/h5/partition_3.h5}</li>
 * </ul>
 * Distinct partition base names therefore give distinct output keys.
 */
public final class ReferenceResolver {

    private ReferenceResolver() {}

    /** Last {@code /}-separated segment of a key, trailing separators ignored. */
    public static String lastSegment(String key) {
        String trimmed = stripTrailingSlash(key);
        int slash = trimmed.lastIndexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(slash + 1);
    }

    /** Last key segment up to its first {@code .}: {@code a/b/partition_3.ms.zip → partition_3}. */
    public static String baseName(String key) {
        String segment = lastSegment(key);
        int dot = segment.indexOf('.');
        return dot < 0 ? segment : segment.substring(0, dot);
    }

    public static ReferencePath rekey(ReferencePath ref, String baseName) {
        return switch (ref.getKind()) {
            case OUTPUT -> ref.withKey(stripTrailingSlash(ref.getKey()) + "/" + baseName, ReferenceKind.OUTPUT);
            case DYNAMIC_INPUT -> ref.withKey(stripTrailingSlash(ref.getKey()) + "/" + baseName, ReferenceKind.INPUT);
            case INPUT -> ref;
        };
    }

    /**
     * Points the designated input at the listed partition object below its own prefix. The prefix
     * is {@link ReferencePath#fullKey()}, the same one the planner lists under.
     */
    public static ReferencePath designate(ReferencePath ref, String partitionKey) {
        return ref.withKeyAndNoExtension(stripTrailingSlash(ref.fullKey()) + "/" + lastSegment(partitionKey));
    }

    /**
     * Resolves every reference in {@code values} (nested groups included) for one partition.
     * Literals pass through unchanged; insertion order is kept.
     */
    public static Map<String, Object> resolveValues(Map<String, Object> values, String inputName, String partitionKey) {
        String base = baseName(partitionKey);
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : values.entrySet()) {
            Object value = e.getValue();
            if (value instanceof ReferencePath ref) {
                resolved.put(e.getKey(), e.getKey().equals(inputName) && ref.isInput()
                        ? designate(ref, partitionKey)
                        : rekey(ref, base));
            } else if (value instanceof Map<?, ?> group) {
                resolved.put(e.getKey(), resolveValues(asGroup(group), null, partitionKey));
            } else {
                resolved.put(e.getKey(), value);
            }
        }
        return Collections.unmodifiableMap(resolved);
    }

    /** Every reference in {@code values}, nested groups included, in declaration order. */
    public static List<ReferencePath> references(Map<String, Object> values) {
        List<ReferencePath> refs = new ArrayList<>();
        for (Object value : values.values()) {
            if (value instanceof ReferencePath ref) {
                refs.add(ref);
            } else if (value instanceof Map<?, ?> group) {
                refs.addAll(references(asGroup(group)));
            }
        }
        return refs;
    }

    /** {@code workDir/container/fullKey}. */
    public static Path localPath(ReferencePath ref, Path workDir) {
        return workDir.resolve(ref.getContainer()).resolve(ref.fullKey());
    }

    /**
     * Key an output is uploaded under. Directories are archived and get a {@code .zip} suffix;
     * an overwrite key redirects the upload to {@code overwriteKey/<file name>}.
     */
    public static String uploadKey(ReferencePath output, boolean directory) {
        String key = output.getOverwriteKey() != null
                ? stripTrailingSlash(output.getOverwriteKey()) + "/" + lastSegment(output.fullKey())
                : output.fullKey();
        return directory ? key + ".zip" : key;
    }

    public static String stripTrailingSlash(String key) {
        String k = key;
        while (k.endsWith("/")) {
            k = k.substring(0, k.length() - 1);
        }
        return k;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asGroup(Map<?, ?> group) {
        return (Map<String, Object>) group;
    }
}
