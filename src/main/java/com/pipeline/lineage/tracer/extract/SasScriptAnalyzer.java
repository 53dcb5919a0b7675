package com.pipeline.lineage.tracer.extract;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.corpus.SourceCorpus;
import com.pipeline.lineage.tracer.model.WriterKind;

import lombok.RequiredArgsConstructor;

/**
 * Per-program table summaries for every SAS file of a corpus.
 */
@RequiredArgsConstructor
public class SasScriptAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(SasScriptAnalyzer.class);

    private final SasProgramExtractor extractor;

    /**
     * @return summaries keyed by path relative to the corpus root, in path order
     */
    public Map<String, SasTableSummary> analyze(SourceCorpus corpus) {
        Map<String, SasTableSummary> summaries = new LinkedHashMap<>();
        for (Path file : corpus.getFiles()) {
            if (WriterKind.forFile(file).orElse(null) != WriterKind.SAS_PROGRAM) {
                continue;
            }
            Optional<String> text = corpus.text(file);
            if (text.isEmpty()) {
                continue;
            }
            SasTableSummary summary = extractor.analyze(text.get());
            log.debug("Analysed {}: {} read, {} written", file, summary.getReads().size(), summary.getWrites().size());
            summaries.put(corpus.relativize(file), summary);
        }
        return summaries;
    }
}
