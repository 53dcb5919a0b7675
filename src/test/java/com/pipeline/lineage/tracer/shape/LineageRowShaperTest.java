package com.pipeline.lineage.tracer.shape;

import com.pipeline.lineage.tracer.model.LineagePath;
import com.pipeline.lineage.tracer.model.LineageRow;
import com.pipeline.lineage.tracer.model.TableName;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LineageRowShaperTest {

    private static final TableName TARGET = TableName.require("rpt.target");
    private static final TableName MID_1 = TableName.require("base.mid1");
    private static final TableName MID_2 = TableName.require("base.mid2");
    private static final TableName SOURCE = TableName.require("src.raw");

    private final LineageRowShaper shaper = new LineageRowShaper();

    @Test
    void testTargetThatIsItsOwnSource() {
        List<LineageRow> rows = shaper.shape(TARGET, List.of(LineagePath.of(TARGET)));

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.getTarget()).isEqualTo("rpt.target");
            assertThat(row.getLayers()).isEmpty();
            assertThat(row.getSource()).isEqualTo("rpt.target");
        });
    }

    @Test
    void testDirectSourceHasNoLayers() {
        LineageRow row = shaper.shape(TARGET, List.of(LineagePath.of(TARGET, SOURCE))).get(0);

        assertThat(row.layerCount()).isZero();
        assertThat(row.getSource()).isEqualTo("src.raw");
    }

    @Test
    void testIntermediateTablesBecomeNumberedLayers() {
        LineageRow row = shaper.shape(TARGET, List.of(LineagePath.of(TARGET, MID_1, MID_2, SOURCE))).get(0);

        assertThat(row.getLayers()).containsExactly("base.mid1", "base.mid2");
        assertThat(row.layer(1)).isEqualTo("base.mid1");
        assertThat(row.layer(2)).isEqualTo("base.mid2");
        assertThat(row.layer(3)).isNull();
    }

    @Test
    void testRowsKeepPathOrder() {
        List<LineageRow> rows = shaper.shape(TARGET, List.of(
                LineagePath.of(TARGET, MID_1, SOURCE),
                LineagePath.of(TARGET, SOURCE)));

        assertThat(rows).extracting(LineageRow::layerCount).containsExactly(1, 0);
    }

    @Test
    void testPathNotStartingAtTargetIsRejected() {
        assertThatThrownBy(() -> shaper.shape(TARGET, List.of(LineagePath.of(MID_1, SOURCE))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rpt.target");
    }
}
