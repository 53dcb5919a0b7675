package com.pipeline.lineage.tracer.output;

import com.pipeline.lineage.tracer.model.ScriptTarget;
import com.pipeline.lineage.tracer.model.TableName;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScriptTargetCsvWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWritesOneRowPerMapping() throws IOException {
        Path out = tempDir.resolve("mapping.csv");

        new ScriptTargetCsvWriter().write(List.of(
                new ScriptTarget("etl/load.py", TableName.require("rpt.sales")),
                new ScriptTarget("views/v.sql", TableName.require("rpt.v_sales"))), out);

        assertThat(Files.readAllLines(out)).extracting(line -> line.replace("\"", "")).containsExactly(
                "script name,target table",
                "etl/load.py,rpt.sales",
                "views/v.sql,rpt.v_sales");
    }

    @Test
    void testEmptyMappingWritesHeaderOnly() throws IOException {
        Path out = tempDir.resolve("empty.csv");

        new ScriptTargetCsvWriter().write(List.of(), out);

        assertThat(Files.readAllLines(out)).extracting(line -> line.replace("\"", ""))
                .containsExactly("script name,target table");
    }
}
