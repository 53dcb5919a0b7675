package com.pipeline.lineage.tracer.corpus;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.model.TraceDiagnostics;

import lombok.Getter;

/**
 * The scanned file list of a corpus plus a read-once cache of each file's text.
 *
 * Unreadable files are reported once and then behave as absent.
 */
public class SourceCorpus {
    private static final Logger log = LoggerFactory.getLogger(SourceCorpus.class);

    @Getter
    private final Path root;

    @Getter
    private final List<Path> files;

    private final SourceFileReader reader;
    private final TraceDiagnostics diagnostics;

    private final Map<Path, Optional<String>> texts = new ConcurrentHashMap<>();
    private final Map<Path, Optional<String>> lowerCaseTexts = new ConcurrentHashMap<>();

    public SourceCorpus(Path root, List<Path> files, SourceFileReader reader, TraceDiagnostics diagnostics) {
        this.root = root;
        this.files = List.copyOf(files);
        this.reader = reader;
        this.diagnostics = diagnostics;
    }

    public static SourceCorpus scan(Path root, TraceDiagnostics diagnostics) throws IOException {
        List<Path> files = new CorpusScanner().listSourceFiles(root);
        return new SourceCorpus(root, files, new SourceFileReader(), diagnostics);
    }

    /**
     * Text of a corpus file, or empty if it could not be read.
     */
    public Optional<String> text(Path file) {
        return texts.computeIfAbsent(file, this::load);
    }

    /**
     * Lower-cased text, used for case-insensitive literal name checks.
     */
    public Optional<String> lowerCaseText(Path file) {
        return lowerCaseTexts.computeIfAbsent(file,
                f -> text(f).map(t -> t.toLowerCase(Locale.ROOT)));
    }

    public String relativize(Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    public int size() {
        return files.size();
    }

    private Optional<String> load(Path file) {
        try {
            return Optional.of(reader.read(file));
        } catch (IOException e) {
            String msg = "Failed to read " + file + " (" + e.getMessage() + ")";
            diagnostics.getWarnings().add(msg);
            log.warn(msg);
            return Optional.empty();
        }
    }
}
