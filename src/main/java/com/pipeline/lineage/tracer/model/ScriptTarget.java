package com.pipeline.lineage.tracer.model;

import java.util.Comparator;

import lombok.NonNull;
import lombok.Value;

/**
 * One script and a table it produces; the script path is relative to the corpus root.
 */
@Value
public class ScriptTarget implements Comparable<ScriptTarget> {

    private static final Comparator<ScriptTarget> ORDER = Comparator
            .comparing(ScriptTarget::getScript)
            .thenComparing(ScriptTarget::getTarget);

    @NonNull
    String script;

    @NonNull
    TableName target;

    @Override
    public int compareTo(ScriptTarget other) {
        return ORDER.compare(this, other);
    }
}
