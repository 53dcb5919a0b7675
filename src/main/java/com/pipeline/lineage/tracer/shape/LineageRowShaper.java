package com.pipeline.lineage.tracer.shape;

import java.util.ArrayList;
import java.util.List;

import com.pipeline.lineage.tracer.model.LineagePath;
import com.pipeline.lineage.tracer.model.LineageRow;
import com.pipeline.lineage.tracer.model.TableName;

/**
 * Turns the variable-length paths of one target into rows with numbered layer cells.
 */
public class LineageRowShaper {

    /**
     * One row per path, in path order. The row's target is always {@code target}; a path of
     * length one yields a row whose target and source coincide.
     *
     * @throws IllegalArgumentException if a path does not start at {@code target}
     */
    public List<LineageRow> shape(TableName target, List<LineagePath> paths) {
        List<LineageRow> rows = new ArrayList<>(paths.size());
        for (LineagePath path : paths) {
            if (!path.head().equals(target)) {
                throw new IllegalArgumentException("Path " + path + " does not start at target " + target);
            }
            List<String> layers = path.layers().stream().map(TableName::getCanonical).toList();
            rows.add(new LineageRow(target.getCanonical(), layers, path.source().getCanonical()));
        }
        return rows;
    }
}
