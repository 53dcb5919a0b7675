package com.pipeline.lineage.tracer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.corpus.SourceCorpus;
import com.pipeline.lineage.tracer.extract.ExtractorRegistry;
import com.pipeline.lineage.tracer.index.CorpusWriterLookup;
import com.pipeline.lineage.tracer.index.WriterIndex;
import com.pipeline.lineage.tracer.index.WriterIndexBuilder;
import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.TargetLineage;
import com.pipeline.lineage.tracer.model.TraceDiagnostics;
import com.pipeline.lineage.tracer.output.LineageCsvWriter;
import com.pipeline.lineage.tracer.output.LineageMarkdownReportWriter;
import com.pipeline.lineage.tracer.resolve.DialectUpstreamExtractor;
import com.pipeline.lineage.tracer.resolve.EnumerationResult;
import com.pipeline.lineage.tracer.resolve.LineagePathEnumerator;
import com.pipeline.lineage.tracer.resolve.UpstreamResolver;
import com.pipeline.lineage.tracer.shape.LineageRowShaper;
import com.pipeline.lineage.tracer.shape.LineageTable;

/**
 * Runs a complete trace: scan the corpus, index writers, enumerate every requested target and
 * write the lineage table.
 */
public class LineageTracer {
    private static final Logger log = LoggerFactory.getLogger(LineageTracer.class);

    private final TracerConfig config;
    private final ExtractorRegistry extractors;
    private final LineageRowShaper shaper = new LineageRowShaper();

    public LineageTracer(TracerConfig config) {
        this(config, ExtractorRegistry.defaults());
    }

    public LineageTracer(TracerConfig config, ExtractorRegistry extractors) {
        this.config = config;
        this.extractors = extractors;
    }

    /**
     * Never throws for domain failures; those are reported through {@link TraceResult#failure}.
     */
    public TraceResult trace() {
        try {
            TraceDiagnostics diagnostics = new TraceDiagnostics();
            Path root = config.getCorpusRoot().toAbsolutePath().normalize();

            log.info("Step 1: Scanning corpus...");
            if (!Files.isDirectory(root)) {
                return TraceResult.failure("Corpus root does not exist or is not a directory: " + root);
            }
            SourceCorpus corpus = SourceCorpus.scan(root, diagnostics);
            if (corpus.size() == 0) {
                return TraceResult.failure("No .py, .sql or .sas files found under " + root);
            }
            log.info("Found {} source file(s) under {}", corpus.size(), root);

            log.info("Step 2: Indexing output tables...");
            WriterIndex index = new WriterIndexBuilder(extractors).build(corpus);

            log.info("Step 3: Resolving targets...");
            List<TableName> targets = new TargetNameExpander(index, diagnostics).expand(config.getTargets());
            if (targets.isEmpty()) {
                return TraceResult.failure("No valid target tables to trace");
            }
            log.info("Tracing {} target(s): {}", targets.size(), targets);

            log.info("Step 4: Enumerating lineage paths...");
            UpstreamResolver resolver = new UpstreamResolver(
                    new CorpusWriterLookup(index, corpus, extractors),
                    new DialectUpstreamExtractor(corpus, extractors),
                    config.getWriterPolicy());
            LineagePathEnumerator enumerator = new LineagePathEnumerator(resolver, config.getBudget());
            List<TargetLineage> lineages = enumerateAll(enumerator, targets, diagnostics);

            log.info("Step 5: Shaping rows...");
            LineageTable table = new LineageTable();
            lineages.forEach(lineage -> table.addAll(lineage.getRows()));

            if (config.getOutputCsv() != null) {
                log.info("Step 6: Writing lineage CSV...");
                new LineageCsvWriter().write(table, config.getOutputCsv());
            }
            if (config.getReportPath() != null) {
                log.info("Step 7: Writing lineage report...");
                new LineageMarkdownReportWriter().write(root, lineages, config.getReportPath());
            }

            log.info("Tracing complete!");

            return TraceResult.builder()
                    .success(true)
                    .filesScanned(corpus.size())
                    .indexedTables(index.size())
                    .lineages(lineages)
                    .table(table)
                    .diagnostics(diagnostics)
                    .outputCsv(config.getOutputCsv())
                    .reportPath(config.getReportPath())
                    .build();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Tracing interrupted");
            return TraceResult.failure("Tracing interrupted");
        } catch (Exception e) {
            log.error("Tracing failed", e);
            return TraceResult.failure(e.getMessage());
        }
    }

    private List<TargetLineage> enumerateAll(LineagePathEnumerator enumerator, List<TableName> targets,
                                             TraceDiagnostics diagnostics)
            throws InterruptedException, ExecutionException {
        int threads = Math.min(Math.max(1, config.getThreads()), targets.size());
        List<TargetLineage> lineages = new ArrayList<>(targets.size());
        if (threads == 1) {
            for (TableName target : targets) {
                lineages.add(traceTarget(enumerator, target, diagnostics));
            }
            return lineages;
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<TargetLineage>> futures = new ArrayList<>(targets.size());
            for (TableName target : targets) {
                futures.add(pool.submit(() -> traceTarget(enumerator, target, diagnostics)));
            }
            for (Future<TargetLineage> future : futures) {
                lineages.add(future.get());
            }
            return lineages;
        } finally {
            pool.shutdownNow();
        }
    }

    private TargetLineage traceTarget(LineagePathEnumerator enumerator, TableName target,
                                      TraceDiagnostics diagnostics) {
        log.info("Tracing dependencies for {}", target);
        EnumerationResult result = enumerator.enumeratePaths(target);
        if (result.isTruncated()) {
            diagnostics.getWarnings().add("Lineage of " + target + " truncated: " + result.getTruncationReason());
        }
        if (result.getCyclesCut() > 0) {
            diagnostics.getInfos().add("Cut " + result.getCyclesCut() + " cycle(s) while tracing " + target);
        }
        log.info("Finished {}: {} path(s)", target, result.getPaths().size());

        return TargetLineage.builder()
                .target(target)
                .paths(result.getPaths())
                .rows(shaper.shape(target, result.getPaths()))
                .truncated(result.isTruncated())
                .truncationReason(result.getTruncationReason())
                .cyclesCut(result.getCyclesCut())
                .build();
    }
}
