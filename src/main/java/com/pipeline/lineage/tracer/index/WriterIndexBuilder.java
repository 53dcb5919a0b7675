package com.pipeline.lineage.tracer.index;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.corpus.SourceCorpus;
import com.pipeline.lineage.tracer.extract.ExtractorRegistry;
import com.pipeline.lineage.tracer.extract.TableExtractor;
import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.Writer;

import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * Builds the {@link WriterIndex} in one batch pass over the corpus.
 *
 * Files are extracted independently (in parallel); results are merged in file order.
 */
@RequiredArgsConstructor
public class WriterIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(WriterIndexBuilder.class);

    private final ExtractorRegistry extractors;

    public WriterIndex build(SourceCorpus corpus) {
        List<FileWrites> perFile = corpus.getFiles().parallelStream()
                .map(file -> extract(corpus, file))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());

        WriterIndex.Builder builder = WriterIndex.builder();
        for (FileWrites writes : perFile) {
            if (!writes.getTables().isEmpty()) {
                log.info("Output hits in {}: {}", writes.getWriter().getScript(), writes.getTables());
            }
            for (TableName table : writes.getTables()) {
                if (isIndexable(table, writes.getWriter())) {
                    builder.add(table, writes.getWriter());
                }
            }
        }

        WriterIndex index = builder.build();
        log.info("Indexing done. Scanned {} files. Indexed {} distinct output table(s).",
                corpus.size(), index.size());
        return index;
    }

    private Optional<FileWrites> extract(SourceCorpus corpus, Path file) {
        Optional<TableExtractor> extractor = extractors.forFile(file);
        Optional<String> text = corpus.text(file);
        if (extractor.isEmpty() || text.isEmpty()) {
            return Optional.empty();
        }
        Writer writer = new Writer(file, extractor.get().kind());
        return Optional.of(new FileWrites(writer, extractor.get().writtenTables(text.get())));
    }

    /**
     * Spark and view writers only declare qualified tables; SAS programs may also produce
     * bare (WORK) datasets.
     */
    static boolean isIndexable(TableName table, Writer writer) {
        return switch (writer.getKind()) {
            case SAS_PROGRAM -> true;
            case SPARK_SCRIPT, VIEW_DEFINITION -> table.isQualified();
        };
    }

    @Value
    private static class FileWrites {
        Writer writer;
        Set<TableName> tables;
    }
}
