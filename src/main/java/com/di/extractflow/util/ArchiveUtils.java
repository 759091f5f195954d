package com.di.extractflow.util;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * Uncompressed ZIP archives with a single root entry named after the archived directory.
 *
 * <p>Binary scientific datasets barely compress, so entries are {@code STORED}; that requires
 * size and CRC to be known before each entry is written.
 */
@Slf4j
public final class ArchiveUtils {

    public static final String ZIP_SUFFIX = ".zip";

    private ArchiveUtils() {}

    /** Archives {@code directory} into a sibling {@code <directory>.zip}. */
    public static Path zipWithoutCompression(Path directory) throws IOException {
        Path zipFile = directory.resolveSibling(directory.getFileName() + ZIP_SUFFIX);
        return zipWithoutCompression(directory, zipFile);
    }

    public static Path zipWithoutCompression(Path directory, Path zipFile) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }
        String root = directory.getFileName().toString();
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted().collect(Collectors.toList());
        }

        try (OutputStream fos = Files.newOutputStream(zipFile);
             ZipOutputStream zos = new ZipOutputStream(new BufferedOutputStream(fos))) {
            zos.setMethod(ZipOutputStream.STORED);
            for (Path p : paths) {
                String rel = directory.relativize(p).toString().replace('\\', '/');
                String name = rel.isEmpty() ? root + "/" : root + "/" + rel;
                if (Files.isDirectory(p)) {
                    ZipEntry entry = storedEntry(name.endsWith("/") ? name : name + "/", 0L, 0L);
                    zos.putNextEntry(entry);
                    zos.closeEntry();
                } else {
                    ZipEntry entry = storedEntry(name, Files.size(p), crc32(p));
                    zos.putNextEntry(entry);
                    Files.copy(p, zos);
                    zos.closeEntry();
                }
            }
        }
        log.debug("[ARCHIVE] {} → {} ({} entries, {} bytes)", directory, zipFile, paths.size(), Files.size(zipFile));
        return zipFile;
    }

    /**
     * Extracts {@code zipFile} next to itself (the {@code .zip} suffix dropped) and deletes the archive.
     */
    public static Path unzip(Path zipFile) throws IOException {
        String fileName = zipFile.getFileName().toString();
        String dirName = fileName.endsWith(ZIP_SUFFIX)
                ? fileName.substring(0, fileName.length() - ZIP_SUFFIX.length())
                : fileName + ".d";
        return unzip(zipFile, zipFile.resolveSibling(dirName));
    }

    /**
     * Extracts {@code zipFile} into {@code targetDir}, stripping the single common root entry when
     * there is one, then deletes the archive.
     *
     * @throws IOException when an entry would land outside {@code targetDir}
     */
    public static Path unzip(Path zipFile, Path targetDir) throws IOException {
        Path target = targetDir.toAbsolutePath().normalize();
        Files.createDirectories(target);

        try (ZipFile zf = new ZipFile(zipFile.toFile())) {
            List<? extends ZipEntry> entries = Collections.list(zf.entries());
            String root = commonRoot(entries);
            for (ZipEntry e : entries) {
                String name = root == null ? e.getName() : e.getName().substring(root.length() + 1);
                if (name.isEmpty()) {
                    continue;
                }
                Path out = target.resolve(name).normalize();
                if (!out.startsWith(target)) {
                    throw new IOException("Zip entry escapes target directory: " + e.getName());
                }
                if (e.isDirectory()) {
                    Files.createDirectories(out);
                } else {
                    Files.createDirectories(out.getParent());
                    try (InputStream in = zf.getInputStream(e)) {
                        Files.copy(in, out, StandardCopyOption.REPLACE_EXISTING);
                    }
                }
            }
        }
        Files.delete(zipFile);
        log.debug("[ARCHIVE] extracted {} → {}", zipFile, target);
        return target;
    }

    /** Total bytes of a file, or of every regular file below a directory. */
    public static long sizeOf(Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            return Files.size(path);
        }
        try (Stream<Path> walk = Files.walk(path)) {
            long total = 0;
            for (Path p : walk.filter(Files::isRegularFile).collect(Collectors.toList())) {
                total += Files.size(p);
            }
            return total;
        }
    }

    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(p);
            }
        }
    }

    /* ------------------------------------------------------------------ */

    /** Returns the first segment shared by every entry when that segment is a directory, else null. */
    static String commonRoot(List<? extends ZipEntry> entries) {
        String root = null;
        for (ZipEntry e : entries) {
            String name = e.getName();
            int slash = name.indexOf('/');
            if (slash <= 0) {
                return null;
            }
            String first = name.substring(0, slash);
            if (first.equals(".") || first.equals("..")) {
                return null;
            }
            if (root == null) {
                root = first;
            } else if (!root.equals(first)) {
                return null;
            }
        }
        return root;
    }

    private static ZipEntry storedEntry(String name, long size, long crc) {
        ZipEntry entry = new ZipEntry(name);
        entry.setMethod(ZipEntry.STORED);
        entry.setSize(size);
        entry.setCompressedSize(size);
        entry.setCrc(crc);
        return entry;
    }

    private static long crc32(Path file) throws IOException {
        CRC32 crc = new CRC32();
        byte[] buffer = new byte[64 * 1024];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                crc.update(buffer, 0, n);
            }
        }
        return crc.getValue();
    }
}
