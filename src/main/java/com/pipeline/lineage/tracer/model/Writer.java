package com.pipeline.lineage.tracer.model;

import java.nio.file.Path;
import java.util.Comparator;

import lombok.NonNull;
import lombok.Value;

/**
 * A script (or view definition) believed to produce a table.
 */
@Value
public class Writer implements Comparable<Writer> {

    private static final Comparator<Writer> ORDER = Comparator
            .comparing((Writer w) -> w.getScript().toString())
            .thenComparing(Writer::getKind);

    @NonNull
    Path script;

    @NonNull
    WriterKind kind;

    @Override
    public int compareTo(Writer other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return kind + ":" + script;
    }
}
