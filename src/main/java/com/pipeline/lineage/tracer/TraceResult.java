package com.pipeline.lineage.tracer;

import java.nio.file.Path;
import java.util.List;

import com.pipeline.lineage.tracer.model.TargetLineage;
import com.pipeline.lineage.tracer.model.TraceDiagnostics;
import com.pipeline.lineage.tracer.shape.LineageTable;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a tracing run.
 */
@Data
@Builder
public class TraceResult {
    private boolean success;
    private String errorMessage;

    private int filesScanned;
    private int indexedTables;

    /** Per target, in request order. */
    private List<TargetLineage> lineages;
    private LineageTable table;
    private TraceDiagnostics diagnostics;

    private Path outputCsv;
    private Path reportPath;

    public int rowCount() {
        return table == null ? 0 : table.getRows().size();
    }

    public long truncatedTargets() {
        return lineages == null ? 0 : lineages.stream().filter(TargetLineage::isTruncated).count();
    }

    public int cyclesCut() {
        return lineages == null ? 0 : lineages.stream().mapToInt(TargetLineage::getCyclesCut).sum();
    }

    public static TraceResult failure(String errorMessage) {
        return TraceResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
