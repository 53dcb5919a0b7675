package com.pipeline.lineage.tracer.extract;

import java.util.Set;

import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.WriterKind;

/**
 * Dialect-specific heuristic that reports which tables a script writes and reads.
 *
 * Implementations are pure functions of the script text: no shared mutable state, so files
 * can be processed in any order or in parallel.
 */
public interface TableExtractor {

    WriterKind kind();

    /**
     * Tables the script declares or produces.
     */
    Set<TableName> writtenTables(String text);

    /**
     * Tables the script reads; these are the upstreams of every table it writes.
     */
    Set<TableName> readTables(String text);
}
