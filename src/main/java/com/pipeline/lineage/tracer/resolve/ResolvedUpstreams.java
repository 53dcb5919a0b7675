package com.pipeline.lineage.tracer.resolve;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.Writer;

import lombok.Value;

/**
 * Writers of a table and the combined set of tables they read.
 */
@Value
public class ResolvedUpstreams {

    Set<Writer> writers;

    /** Lexicographic order on the canonical name. */
    SortedSet<TableName> upstreams;

    public ResolvedUpstreams(Set<Writer> writers, Set<TableName> upstreams) {
        this.writers = Collections.unmodifiableSet(new TreeSet<>(writers));
        this.upstreams = Collections.unmodifiableSortedSet(new TreeSet<>(upstreams));
    }

    /**
     * A source table: nothing writes it, or its writers read nothing.
     */
    public boolean isTerminal() {
        return writers.isEmpty() || upstreams.isEmpty();
    }
}
