package com.pipeline.lineage.tracer.resolve;

import java.util.Set;

import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.Writer;

/**
 * Reports the tables a writer reads.
 */
@FunctionalInterface
public interface UpstreamExtractor {

    Set<TableName> readTables(Writer writer);
}
