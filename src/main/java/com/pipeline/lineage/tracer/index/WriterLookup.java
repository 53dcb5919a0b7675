package com.pipeline.lineage.tracer.index;

import java.util.Set;

import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.Writer;

/**
 * Answers "which scripts write table T?".
 */
@FunctionalInterface
public interface WriterLookup {

    Set<Writer> writersFor(TableName table);
}
