package com.pipeline.lineage.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.cli.model.TraceOptions;
import com.pipeline.lineage.cli.model.ValidatedTraceOptions;
import com.pipeline.lineage.tracer.TraceResult;
import com.pipeline.lineage.tracer.model.TargetLineage;

/**
 * Responsible only for printing CLI output for the "trace" command.
 * No validation, no execution.
 */
public class TraceResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(TraceResultsPrinter.class);

    public void printBanner(TraceOptions o, ValidatedTraceOptions v) {
        log.info("=================================================");
        log.info("Pipeline Lineage Tracer");
        log.info("=================================================");
        log.info("Corpus Root: {}", v.getCorpusRoot());
        log.info("Targets: {}", v.getTargets());
        log.info("Output CSV: {}", o.getOut().toAbsolutePath());
        log.info("Report: {}", o.getReport() != null ? o.getReport().toAbsolutePath() : "None");
        log.info("Max Paths per Target: {}", v.getBudget().getMaxPaths());
        log.info("Max Depth: {}", v.getBudget().getMaxDepth());
        log.info("Timeout per Target: {}", v.getBudget().getTimeout() != null ? v.getBudget().getTimeout() : "None");
        log.info("Threads: {}", o.getThreads());
        log.info("Writer Policy: {}", o.getWriterPolicy());
        log.info("=================================================");
    }

    public void printSuccess(TraceResult result) {
        log.info("");
        log.info("=================================================");
        log.info("TRACING SUCCESSFUL");
        log.info("=================================================");
        log.info("Files Scanned: {}", result.getFilesScanned());
        log.info("Indexed Output Tables: {}", result.getIndexedTables());
        log.info("Targets Traced: {}", result.getLineages().size());
        log.info("Lineage Rows: {}", result.rowCount());
        log.info("Layer Columns: {}", result.getTable().getMaxLayers());

        log.info("");
        log.info("Per Target:");
        for (TargetLineage lineage : result.getLineages()) {
            if (lineage.isTruncated()) {
                log.info("  {}: {} path(s), TRUNCATED ({})", lineage.getTarget(), lineage.pathCount(),
                        lineage.getTruncationReason());
            } else {
                log.info("  {}: {} path(s)", lineage.getTarget(), lineage.pathCount());
            }
        }

        if (result.truncatedTargets() > 0 || result.cyclesCut() > 0) {
            log.info("");
            log.info("Warnings Summary:");
            log.info("  Truncated Targets: {}", result.truncatedTargets());
            log.info("  Cycles Cut: {}", result.cyclesCut());
        }

        log.info("");
        log.info("Output CSV: {}", result.getOutputCsv().toAbsolutePath());
        if (result.getReportPath() != null) {
            log.info("Report: {}", result.getReportPath().toAbsolutePath());
        }
        log.info("=================================================");
    }

    public void printFailure(TraceResult result) {
        log.error("Tracing failed: {}", result.getErrorMessage());
    }
}
