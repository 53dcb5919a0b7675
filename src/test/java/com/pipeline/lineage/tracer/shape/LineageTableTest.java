package com.pipeline.lineage.tracer.shape;

import com.pipeline.lineage.tracer.model.LineageRow;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LineageTableTest {

    @Test
    void testHeaderIsWidenedByLongestRowOfRun() {
        LineageTable table = new LineageTable()
                .addAll(List.of(new LineageRow("db.a", List.of(), "db.src")))
                .addAll(List.of(new LineageRow("db.b", List.of("db.m1", "db.m2", "db.m3"), "db.src")));

        assertThat(table.getMaxLayers()).isEqualTo(3);
        assertThat(table.header()).containsExactly(
                "Target Table", "Layer 1", "Layer 2", "Layer 3", "Source Table");
    }

    @Test
    void testNarrowRowsLeaveLayerCellsEmpty() {
        LineageTable table = new LineageTable().addAll(List.of(
                new LineageRow("db.a", List.of("db.m1"), "db.src"),
                new LineageRow("db.b", List.of("db.m1", "db.m2"), "db.src")));

        assertThat(table.cells(table.getRows().get(0))).containsExactly("db.a", "db.m1", "", "db.src");
        assertThat(table.cells(table.getRows().get(1))).containsExactly("db.b", "db.m1", "db.m2", "db.src");
    }

    @Test
    void testNoLayersGivesTwoColumns() {
        LineageTable table = new LineageTable().addAll(List.of(new LineageRow("db.a", List.of(), "db.a")));

        assertThat(table.header()).containsExactly("Target Table", "Source Table");
    }
}
