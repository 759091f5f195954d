package com.di.extractflow.reference;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * A reference to data in object storage used as a parameter value.
 *
 * <p>Equality is by {@code (container, key, extension)}; the kind and the overwrite key are
 * routing hints and do not change which object is meant.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class ReferencePath {

    @EqualsAndHashCode.Include
    private final String container;
    @EqualsAndHashCode.Include
    private final String key;
    @EqualsAndHashCode.Include
    private final String extension;
    private final ReferenceKind kind;
    /** Outputs only: uploads go to {@code overwriteKey/<file name>} instead of the resolved key. */
    private final String overwriteKey;

    private ReferencePath(String container, String key, String extension, ReferenceKind kind, String overwriteKey) {
        if (container == null || container.isBlank()) {
            throw new IllegalArgumentException("container must not be blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        Objects.requireNonNull(kind, "kind");
        if (overwriteKey != null && kind != ReferenceKind.OUTPUT) {
            throw new IllegalArgumentException("Only outputs may carry an overwrite key: " + container + "/" + key);
        }
        this.container = container;
        this.key = key;
        this.extension = extension == null || extension.isBlank() ? null : stripDot(extension);
        this.kind = kind;
        this.overwriteKey = overwriteKey;
    }

    public static ReferencePath input(String container, String key) {
        return new ReferencePath(container, key, null, ReferenceKind.INPUT, null);
    }

    public static ReferencePath input(String container, String key, String extension) {
        return new ReferencePath(container, key, extension, ReferenceKind.INPUT, null);
    }

    public static ReferencePath dynamicInput(String container, String key, String extension) {
        return new ReferencePath(container, key, extension, ReferenceKind.DYNAMIC_INPUT, null);
    }

    public static ReferencePath output(String container, String key, String extension) {
        return new ReferencePath(container, key, extension, ReferenceKind.OUTPUT, null);
    }

    public ReferencePath withOverwriteKey(String overwriteKey) {
        return new ReferencePath(container, key, extension, kind, overwriteKey);
    }

    ReferencePath withKey(String newKey, ReferenceKind newKind) {
        return new ReferencePath(container, newKey, extension, newKind,
                newKind == ReferenceKind.OUTPUT ? overwriteKey : null);
    }

    ReferencePath withKeyAndNoExtension(String newKey) {
        return new ReferencePath(container, newKey, null, ReferenceKind.INPUT, null);
    }

    public boolean isInput() {
        return kind != ReferenceKind.OUTPUT;
    }

    public boolean isOutput() {
        return kind == ReferenceKind.OUTPUT;
    }

    /** The key with the extension appended: the object (or prefix) actually addressed. */
    public String fullKey() {
        return extension == null ? key : key + "." + extension;
    }

    @Override
    public String toString() {
        return kind + "(" + container + "/" + fullKey() + (overwriteKey == null ? "" : " ⇒ " + overwriteKey) + ")";
    }

    private static String stripDot(String ext) {
        return ext.startsWith(".") ? ext.substring(1) : ext;
    }
}
