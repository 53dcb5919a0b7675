package com.pipeline.lineage.tracer.resolve;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Limits applied to the enumeration of a single target.
 */
@Value
@Builder
public class EnumerationBudget {

    public static final int DEFAULT_MAX_PATHS = 10_000;
    public static final int DEFAULT_MAX_DEPTH = 64;

    @Builder.Default
    int maxPaths = DEFAULT_MAX_PATHS;

    /** Maximum number of tables on one path, target included. */
    @Builder.Default
    int maxDepth = DEFAULT_MAX_DEPTH;

    /** Wall-clock limit per target; {@code null} means none. */
    Duration timeout;

    public static EnumerationBudget defaults() {
        return EnumerationBudget.builder().build();
    }
}
