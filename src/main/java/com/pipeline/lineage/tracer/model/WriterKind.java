package com.pipeline.lineage.tracer.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of script that writes a table. Decides which extraction rules apply to it.
 */
public enum WriterKind {

    SPARK_SCRIPT(".py"),
    VIEW_DEFINITION(".sql"),
    SAS_PROGRAM(".sas");

    private final String extension;

    WriterKind(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Kind implied by a file's extension (case-insensitive), if it is one the tracer reads.
     */
    public static Optional<WriterKind> forFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (WriterKind kind : values()) {
            if (name.endsWith(kind.extension)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
