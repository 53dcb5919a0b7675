package com.pipeline.lineage.tracer.output;

import com.pipeline.lineage.tracer.model.LineageRow;
import com.pipeline.lineage.tracer.shape.LineageTable;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LineageCsvWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWritesHeaderAndRowsInColumnOrder() throws IOException {
        LineageTable table = new LineageTable().addAll(List.of(
                new LineageRow("rpt.t", List.of("base.m1", "base.m2"), "src.raw"),
                new LineageRow("rpt.t", List.of(), "src.other"),
                new LineageRow("rpt.solo", List.of(), "rpt.solo")));
        Path out = tempDir.resolve("nested/lineage.csv");

        new LineageCsvWriter().write(table, out);

        List<String> lines = Files.readAllLines(out);
        assertThat(lines).hasSize(4);
        assertThat(lines.get(0).replace("\"", "")).isEqualTo("Target Table,Layer 1,Layer 2,Source Table");
        assertThat(lines.get(1).replace("\"", "")).isEqualTo("rpt.t,base.m1,base.m2,src.raw");
        assertThat(lines.get(2).replace("\"", "")).isEqualTo("rpt.t,,,src.other");
        assertThat(lines.get(3).replace("\"", "")).isEqualTo("rpt.solo,,,rpt.solo");
    }

    @Test
    void testWrittenFileReadsBackWithSameHeader() throws IOException {
        LineageTable table = new LineageTable().addAll(List.of(
                new LineageRow("rpt.t", List.of("base.m1"), "src.raw")));
        Path out = tempDir.resolve("lineage.csv");

        new LineageCsvWriter().write(table, out);
        LineageCsv read = new LineageCsvReader().read(out);

        assertThat(read.getHeader()).containsExactly("Target Table", "Layer 1", "Source Table");
        assertThat(read.getRows()).singleElement().satisfies(row -> {
            assertThat(row).containsEntry("Target Table", "rpt.t");
            assertThat(row).containsEntry("Layer 1", "base.m1");
            assertThat(row).containsEntry("Source Table", "src.raw");
        });
    }

    @Test
    void testReaderIgnoresByteOrderMark() throws IOException {
        Path in = tempDir.resolve("bom.csv");
        Files.writeString(in, "\uFEFFTarget Table,Source Table\nrpt.t,src.raw\n");

        LineageCsv read = new LineageCsvReader().read(in);

        assertThat(read.getHeader()).containsExactly("Target Table", "Source Table");
        assertThat(read.getRows()).hasSize(1);
    }

    @Test
    void testEmptyFileHasNoHeader() throws IOException {
        Path in = tempDir.resolve("empty.csv");
        Files.writeString(in, "");

        assertThatThrownBy(() -> new LineageCsvReader().read(in))
                .isInstanceOf(LineageFormatException.class)
                .hasMessageContaining("header");
    }
}
