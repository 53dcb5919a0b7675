package com.pipeline.lineage.tracer.index;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.corpus.SourceCorpus;
import com.pipeline.lineage.tracer.extract.ExtractorRegistry;
import com.pipeline.lineage.tracer.extract.TableExtractor;
import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.Writer;

import lombok.RequiredArgsConstructor;

/**
 * Writer lookup backed by the index and re-checked against the corpus text.
 *
 * Index entries are kept only if the script still mentions the table's literal name. When
 * nothing survives (or the table was never indexed) the files that mention the name are
 * re-scanned directly with their write rules.
 */
@RequiredArgsConstructor
public class CorpusWriterLookup implements WriterLookup {
    private static final Logger log = LoggerFactory.getLogger(CorpusWriterLookup.class);

    private final WriterIndex index;
    private final SourceCorpus corpus;
    private final ExtractorRegistry extractors;

    @Override
    public Set<Writer> writersFor(TableName table) {
        List<Path> candidates = candidateFiles(table);
        log.debug("Table '{}': {} candidate file(s) by literal name", table, candidates.size());

        Set<Writer> writers = new TreeSet<>();
        for (Writer writer : index.writers(table)) {
            if (candidates.contains(writer.getScript())) {
                writers.add(writer);
            }
        }

        if (writers.isEmpty()) {
            if (!index.writers(table).isEmpty()) {
                log.debug("Table '{}': indexed writers failed the literal name check, re-scanning", table);
            }
            writers.addAll(rescan(table, candidates));
        }

        if (writers.size() > 1) {
            log.info("Table '{}': {} writers, their upstreams are combined", table, writers.size());
        } else {
            log.debug("Table '{}': {} confirmed writer(s)", table, writers.size());
        }
        return writers;
    }

    /**
     * Corpus files whose lower-cased text contains {@code table} on word boundaries.
     */
    List<Path> candidateFiles(TableName table) {
        Pattern literal = Pattern.compile("\\b" + Pattern.quote(table.getCanonical()) + "\\b");
        List<Path> out = new ArrayList<>();
        for (Path file : corpus.getFiles()) {
            Optional<String> text = corpus.lowerCaseText(file);
            if (text.isPresent() && literal.matcher(text.get()).find()) {
                out.add(file);
            }
        }
        return out;
    }

    private Set<Writer> rescan(TableName table, List<Path> candidates) {
        Set<Writer> found = new TreeSet<>();
        for (Path file : candidates) {
            Optional<TableExtractor> extractor = extractors.forFile(file);
            Optional<String> text = corpus.text(file);
            if (extractor.isEmpty() || text.isEmpty()) {
                continue;
            }
            Writer writer = new Writer(file, extractor.get().kind());
            if (extractor.get().writtenTables(text.get()).contains(table)
                    && WriterIndexBuilder.isIndexable(table, writer)) {
                found.add(writer);
            }
        }
        if (!found.isEmpty()) {
            log.info("Table '{}': {} writer(s) found by direct re-scan", table, found.size());
        }
        return found;
    }
}
