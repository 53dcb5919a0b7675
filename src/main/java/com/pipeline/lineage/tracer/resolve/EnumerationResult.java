package com.pipeline.lineage.tracer.resolve;

import java.util.List;

import com.pipeline.lineage.tracer.model.LineagePath;
import com.pipeline.lineage.tracer.model.TableName;

import lombok.Value;

@Value
public class EnumerationResult {

    TableName target;
    List<LineagePath> paths;
    boolean truncated;
    String truncationReason;
    int cyclesCut;

    public EnumerationResult(TableName target, List<LineagePath> paths, boolean truncated,
                             String truncationReason, int cyclesCut) {
        this.target = target;
        this.paths = List.copyOf(paths);
        this.truncated = truncated;
        this.truncationReason = truncationReason;
        this.cyclesCut = cyclesCut;
    }
}
