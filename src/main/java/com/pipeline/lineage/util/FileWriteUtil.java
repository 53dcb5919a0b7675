package com.pipeline.lineage.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File helpers for the tool's outputs.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes UTF-8 content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        createParentDirectories(filePath);
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    public static void createParentDirectories(Path filePath) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
    }

    /**
     * Sibling of {@code file} with {@code suffix} inserted before the extension, e.g.
     * {@code lineage.csv} to {@code lineage_expanded.csv}. A file without extension gets
     * {@code defaultExtension}.
     */
    public static Path withStemSuffix(Path file, String suffix, String defaultExtension) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : defaultExtension;
        return file.resolveSibling(stem + suffix + extension);
    }
}
