package com.pipeline.lineage.tracer.model;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Shaped form of one lineage path: {@code Target, Layer 1..k, Source}.
 */
@Value
public class LineageRow {

    @NonNull
    String target;

    @NonNull
    List<String> layers;

    @NonNull
    String source;

    public LineageRow(String target, List<String> layers, String source) {
        this.target = target;
        this.layers = List.copyOf(layers);
        this.source = source;
    }

    public int layerCount() {
        return layers.size();
    }

    /**
     * Layer at a 1-based position, or {@code null} when this row is narrower.
     */
    public String layer(int position) {
        return position >= 1 && position <= layers.size() ? layers.get(position - 1) : null;
    }
}
