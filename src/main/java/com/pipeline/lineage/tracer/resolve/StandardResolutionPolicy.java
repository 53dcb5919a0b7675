package com.pipeline.lineage.tracer.resolve;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import com.pipeline.lineage.tracer.model.TableName;

/**
 * Built-in ways to combine the upstreams of ambiguous writers.
 */
public enum StandardResolutionPolicy implements WriterResolutionPolicy {

    /**
     * Every writer is an alternative production route whose inputs may all be required.
     */
    UNION {
        @Override
        public SortedSet<TableName> combine(List<Set<TableName>> perWriter) {
            SortedSet<TableName> out = new TreeSet<>();
            perWriter.forEach(out::addAll);
            return out;
        }
    },

    /**
     * Only upstreams every writer agrees on.
     */
    INTERSECTION {
        @Override
        public SortedSet<TableName> combine(List<Set<TableName>> perWriter) {
            if (perWriter.isEmpty()) {
                return new TreeSet<>();
            }
            SortedSet<TableName> out = new TreeSet<>(perWriter.get(0));
            for (Set<TableName> upstreams : perWriter.subList(1, perWriter.size())) {
                out.retainAll(upstreams);
            }
            return out;
        }
    }
}
