package com.pipeline.lineage.tracer.extract;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.pipeline.lineage.tracer.model.WriterKind;

/**
 * Maps each writer kind to its dialect extractor.
 */
public class ExtractorRegistry {

    private final Map<WriterKind, TableExtractor> extractors = new EnumMap<>(WriterKind.class);

    public ExtractorRegistry(List<TableExtractor> extractors) {
        for (TableExtractor extractor : extractors) {
            this.extractors.put(extractor.kind(), extractor);
        }
    }

    public static ExtractorRegistry defaults() {
        return new ExtractorRegistry(List.of(
                new SparkScriptExtractor(),
                new ViewDefinitionExtractor(),
                new SasProgramExtractor()));
    }

    public Optional<TableExtractor> forKind(WriterKind kind) {
        return Optional.ofNullable(extractors.get(kind));
    }

    public Optional<TableExtractor> forFile(Path file) {
        return WriterKind.forFile(file).flatMap(this::forKind);
    }
}
