package com.pipeline.lineage.tracer;

import java.nio.file.Path;
import java.util.List;

import com.pipeline.lineage.tracer.resolve.EnumerationBudget;
import com.pipeline.lineage.tracer.resolve.StandardResolutionPolicy;
import com.pipeline.lineage.tracer.resolve.WriterResolutionPolicy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Settings of one tracing run.
 */
@Value
@Builder
public class TracerConfig {

    @NonNull
    Path corpusRoot;

    /** Requested targets as given, qualified or bare; expanded against the index. */
    @Singular
    List<String> targets;

    /** Lineage CSV destination; nothing is written when {@code null}. */
    Path outputCsv;

    /** Optional Markdown report destination. */
    Path reportPath;

    @Builder.Default
    EnumerationBudget budget = EnumerationBudget.defaults();

    @Builder.Default
    int threads = 1;

    @Builder.Default
    WriterResolutionPolicy writerPolicy = StandardResolutionPolicy.UNION;
}
