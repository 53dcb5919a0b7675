package com.pipeline.lineage.tracer.output;

import com.pipeline.lineage.tracer.model.LineagePath;
import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.TargetLineage;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LineageMarkdownReportWriterTest {

    @Test
    void testReportListsTargetsAndChains() throws IOException {
        TableName target = TableName.require("rpt.sales");
        TargetLineage lineage = TargetLineage.builder()
                .target(target)
                .path(LineagePath.of(target, TableName.require("base.sales"), TableName.require("src.pos")))
                .truncated(true)
                .truncationReason("path limit of 1 reached")
                .build();

        String report = new LineageMarkdownReportWriter().render(Path.of("corpus"), List.of(lineage));

        assertThat(report)
                .contains("# Table Lineage Report")
                .contains("| `rpt.sales` | 1 | yes | 0 |")
                .contains("## rpt.sales")
                .contains("> Truncated: path limit of 1 reached")
                .contains("- `rpt.sales <- base.sales <- src.pos`");
    }
}
