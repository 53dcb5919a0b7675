package com.pipeline.lineage.tracer.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.Writer;

/**
 * Read-only lookup: canonical table name to the scripts that write it.
 *
 * Built once through {@link Builder}; never mutated afterwards, so it can be shared by any
 * number of resolving threads without locking.
 */
public final class WriterIndex {

    private final Map<TableName, Set<Writer>> writersByTable;

    private WriterIndex(Map<TableName, Set<Writer>> writersByTable) {
        this.writersByTable = writersByTable;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registered writers of {@code table}, in script order; empty if the table is not indexed.
     */
    public Set<Writer> writers(TableName table) {
        return writersByTable.getOrDefault(table, Collections.emptySet());
    }

    public boolean contains(TableName table) {
        return writersByTable.containsKey(table);
    }

    /**
     * All indexed tables in canonical order.
     */
    public Set<TableName> tables() {
        return writersByTable.keySet();
    }

    public int size() {
        return writersByTable.size();
    }

    /**
     * Qualified tables whose table part equals {@code bareName}, e.g. {@code rpt.sales} for
     * {@code sales}.
     */
    public List<TableName> qualifiedMatches(String bareName) {
        String suffix = "." + bareName;
        List<TableName> out = new ArrayList<>();
        for (TableName table : writersByTable.keySet()) {
            if (table.isQualified() && table.getCanonical().endsWith(suffix)) {
                out.add(table);
            }
        }
        return out;
    }

    /**
     * Append-only accumulator used while the corpus is scanned.
     */
    public static final class Builder {
        private final Map<TableName, SortedSet<Writer>> entries = new TreeMap<>();

        private Builder() {
        }

        public Builder add(TableName table, Writer writer) {
            entries.computeIfAbsent(table, t -> new TreeSet<>()).add(writer);
            return this;
        }

        public WriterIndex build() {
            Map<TableName, Set<Writer>> frozen = new TreeMap<>();
            entries.forEach((table, writers) ->
                    frozen.put(table, Collections.unmodifiableSortedSet(new TreeSet<>(writers))));
            return new WriterIndex(Collections.unmodifiableMap(frozen));
        }
    }
}
