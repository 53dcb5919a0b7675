package com.pipeline.lineage.tracer.shape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pipeline.lineage.tracer.model.LineageRow;

/**
 * All rows of a run, grouped by target in request order, with a column layout wide enough for
 * the longest row.
 */
public class LineageTable {

    public static final String TARGET_COLUMN = "Target Table";
    public static final String SOURCE_COLUMN = "Source Table";
    public static final String LAYER_PREFIX = "Layer ";

    private final List<LineageRow> rows = new ArrayList<>();
    private int maxLayers;

    public LineageTable addAll(List<LineageRow> targetRows) {
        for (LineageRow row : targetRows) {
            rows.add(row);
            maxLayers = Math.max(maxLayers, row.layerCount());
        }
        return this;
    }

    public List<LineageRow> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public int getMaxLayers() {
        return maxLayers;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * {@code Target Table, Layer 1 .. Layer N, Source Table}.
     */
    public List<String> header() {
        List<String> header = new ArrayList<>(maxLayers + 2);
        header.add(TARGET_COLUMN);
        for (int i = 1; i <= maxLayers; i++) {
            header.add(layerColumn(i));
        }
        header.add(SOURCE_COLUMN);
        return header;
    }

    /**
     * Cells of {@code row} aligned to {@link #header()}; missing layers are empty strings.
     */
    public List<String> cells(LineageRow row) {
        List<String> cells = new ArrayList<>(maxLayers + 2);
        cells.add(row.getTarget());
        for (int i = 1; i <= maxLayers; i++) {
            String layer = row.layer(i);
            cells.add(layer == null ? "" : layer);
        }
        cells.add(row.getSource());
        return cells;
    }

    public static String layerColumn(int position) {
        return LAYER_PREFIX + position;
    }
}
