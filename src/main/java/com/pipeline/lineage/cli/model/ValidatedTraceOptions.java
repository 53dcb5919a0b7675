package com.pipeline.lineage.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.pipeline.lineage.tracer.resolve.EnumerationBudget;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps TraceCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedTraceOptions {
    Path corpusRoot;
    List<String> targets;
    EnumerationBudget budget;
}
