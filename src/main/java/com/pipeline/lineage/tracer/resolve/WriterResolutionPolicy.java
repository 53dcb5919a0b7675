package com.pipeline.lineage.tracer.resolve;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;

import com.pipeline.lineage.tracer.model.TableName;

/**
 * Decides how the upstream sets of several writers of the same table are combined.
 */
@FunctionalInterface
public interface WriterResolutionPolicy {

    /**
     * @param perWriter one upstream set per writer, in writer order; never empty
     */
    SortedSet<TableName> combine(List<Set<TableName>> perWriter);
}
