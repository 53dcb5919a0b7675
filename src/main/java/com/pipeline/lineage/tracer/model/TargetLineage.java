package com.pipeline.lineage.tracer.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything resolved for one requested target.
 */
@Value
@Builder
public class TargetLineage {

    @NonNull
    TableName target;

    @NonNull
    @Singular
    List<LineagePath> paths;

    @NonNull
    @Singular
    List<LineageRow> rows;

    boolean truncated;

    /** Why enumeration stopped early; {@code null} unless truncated. */
    String truncationReason;

    int cyclesCut;

    public int pathCount() {
        return paths.size();
    }
}
