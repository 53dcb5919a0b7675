package com.pipeline.lineage.tracer.resolve;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;

import com.pipeline.lineage.tracer.corpus.SourceCorpus;
import com.pipeline.lineage.tracer.extract.ExtractorRegistry;
import com.pipeline.lineage.tracer.extract.TableExtractor;
import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.Writer;

import lombok.RequiredArgsConstructor;

/**
 * Reads the writer's script from the corpus and applies the read rules of its kind.
 * An unreadable script has no upstreams.
 */
@RequiredArgsConstructor
public class DialectUpstreamExtractor implements UpstreamExtractor {

    private final SourceCorpus corpus;
    private final ExtractorRegistry extractors;

    @Override
    public Set<TableName> readTables(Writer writer) {
        Optional<TableExtractor> extractor = extractors.forKind(writer.getKind());
        Optional<String> text = corpus.text(writer.getScript());
        if (extractor.isEmpty() || text.isEmpty()) {
            return Collections.emptySet();
        }
        return extractor.get().readTables(text.get());
    }
}
