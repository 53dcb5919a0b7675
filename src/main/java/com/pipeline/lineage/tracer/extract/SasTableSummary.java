package com.pipeline.lineage.tracer.extract;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import com.pipeline.lineage.tracer.model.TableName;

import lombok.Value;

/**
 * Tables read and written by one SAS program, in canonical order.
 */
@Value
public class SasTableSummary {

    Set<TableName> reads;
    Set<TableName> writes;

    public SasTableSummary(Set<TableName> reads, Set<TableName> writes) {
        this.reads = Collections.unmodifiableSortedSet(new TreeSet<>(reads));
        this.writes = Collections.unmodifiableSortedSet(new TreeSet<>(writes));
    }

    /** Read but never written by the program. */
    public Set<TableName> inputs() {
        Set<TableName> out = new TreeSet<>(reads);
        out.removeAll(writes);
        return out;
    }

    /** Both written and read by the program, e.g. WORK tables. */
    public Set<TableName> intermediates() {
        Set<TableName> out = new TreeSet<>(reads);
        out.retainAll(writes);
        return out;
    }

    /** Written but never read back by the program. */
    public Set<TableName> outputs() {
        Set<TableName> out = new TreeSet<>(writes);
        out.removeAll(reads);
        return out;
    }
}
