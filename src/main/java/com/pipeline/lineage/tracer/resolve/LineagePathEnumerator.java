package com.pipeline.lineage.tracer.resolve;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.model.LineagePath;
import com.pipeline.lineage.tracer.model.TableName;

/**
 * Depth-first enumeration of every upstream chain of a target, ending at source tables.
 *
 * <ul>
 *   <li>A table already on the current ancestor chain closes the branch as {@code [table]} and
 *       counts as a cut cycle.</li>
 *   <li>A table with no writers, or whose writers read nothing, is a source.</li>
 *   <li>Upstreams are visited in canonical order, so output is stable between runs.</li>
 *   <li>A target cut off by the budget before reaching any source yields {@code [target]}.</li>
 * </ul>
 *
 * Instances are stateless apart from the shared resolver and may be used from several threads.
 */
public class LineagePathEnumerator {
    private static final Logger log = LoggerFactory.getLogger(LineagePathEnumerator.class);

    private final UpstreamResolver resolver;
    private final EnumerationBudget budget;

    public LineagePathEnumerator(UpstreamResolver resolver, EnumerationBudget budget) {
        this.resolver = resolver;
        this.budget = budget;
    }

    public LineagePathEnumerator(UpstreamResolver resolver) {
        this(resolver, EnumerationBudget.defaults());
    }

    public EnumerationResult enumeratePaths(TableName target) {
        Walk walk = new Walk(budget);
        List<LineagePath> paths = visit(target, new HashSet<>(), 1, walk);
        if (paths.isEmpty()) {
            // stopped before any leaf: keep the target visible as its own row
            paths = walk.leaf(target);
        }

        if (walk.truncationReason != null) {
            log.warn("Lineage of '{}' truncated after {} path(s): {}", target, paths.size(), walk.truncationReason);
        }
        return new EnumerationResult(target, paths, walk.truncationReason != null, walk.truncationReason,
                walk.cyclesCut);
    }

    private List<LineagePath> visit(TableName table, Set<TableName> ancestors, int depth, Walk walk) {
        if (ancestors.contains(table)) {
            walk.cyclesCut++;
            log.warn("Cycle detected at '{}'. Cutting branch.", table);
            return walk.leaf(table);
        }

        ResolvedUpstreams resolved = resolver.resolve(table);
        if (resolved.getWriters().isEmpty()) {
            log.debug("No writer found for '{}'. Treat as source.", table);
            return walk.leaf(table);
        }
        if (resolved.getUpstreams().isEmpty()) {
            log.debug("'{}' has no upstreams. Treat as source.", table);
            return walk.leaf(table);
        }
        if (depth >= budget.getMaxDepth()) {
            walk.truncate("depth limit of " + budget.getMaxDepth() + " reached at '" + table + "'");
            return walk.leaf(table);
        }

        ancestors.add(table);
        List<LineagePath> paths = new ArrayList<>();
        try {
            for (TableName upstream : resolved.getUpstreams()) {
                if (walk.exhausted()) {
                    break;
                }
                for (LineagePath path : visit(upstream, ancestors, depth + 1, walk)) {
                    paths.add(path.prepend(table));
                }
            }
        } finally {
            ancestors.remove(table);
        }
        return paths;
    }

    /**
     * Mutable state of one enumeration: leaves produced so far, cut cycles and the stop reason.
     */
    private static final class Walk {
        private final int maxPaths;
        private final long deadline;
        private int leaves;
        private int cyclesCut;
        private String truncationReason;

        private Walk(EnumerationBudget budget) {
            this.maxPaths = budget.getMaxPaths();
            this.deadline = budget.getTimeout() == null ? Long.MAX_VALUE
                    : System.nanoTime() + budget.getTimeout().toNanos();
        }

        private List<LineagePath> leaf(TableName table) {
            leaves++;
            return List.of(LineagePath.of(table));
        }

        /**
         * Checked before each further branch: stops once the path limit or the deadline is hit.
         */
        private boolean exhausted() {
            if (leaves >= maxPaths) {
                truncate("path limit of " + maxPaths + " reached");
                return true;
            }
            if (deadline != Long.MAX_VALUE && System.nanoTime() - deadline > 0) {
                truncate("time budget exceeded");
                return true;
            }
            return false;
        }

        private void truncate(String reason) {
            if (truncationReason == null) {
                truncationReason = reason;
            }
        }
    }
}
