package com.pipeline.lineage.integration;

import com.pipeline.lineage.tracer.LineageTracer;
import com.pipeline.lineage.tracer.TraceResult;
import com.pipeline.lineage.tracer.TracerConfig;
import com.pipeline.lineage.tracer.corpus.SourceCorpus;
import com.pipeline.lineage.tracer.extract.ExtractorRegistry;
import com.pipeline.lineage.tracer.extract.SasProgramExtractor;
import com.pipeline.lineage.tracer.extract.SasScriptAnalyzer;
import com.pipeline.lineage.tracer.extract.SasTableSummary;
import com.pipeline.lineage.tracer.index.ScriptTargetMapper;
import com.pipeline.lineage.tracer.index.WriterIndex;
import com.pipeline.lineage.tracer.index.WriterIndexBuilder;
import com.pipeline.lineage.tracer.model.LineagePath;
import com.pipeline.lineage.tracer.model.ScriptTarget;
import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.TargetLineage;
import com.pipeline.lineage.tracer.model.TraceDiagnostics;
import com.pipeline.lineage.tracer.output.LineageCsv;
import com.pipeline.lineage.tracer.output.LineageCsvReader;
import com.pipeline.lineage.tracer.resolve.EnumerationBudget;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Traces a small mixed corpus of Spark scripts, a view definition and a SAS program end to end.
 */
class LineageTracerIntegrationTest {

    @TempDir
    Path corpusRoot;

    @TempDir
    Path outDir;

    @BeforeEach
    void setUp() throws IOException {
        write("etl/base_to_report.py", """
                ##########################################
                # Output tables:
                #   rpt.sales_summary
                # Input tables:
                #   base.sales
                ##########################################
                sales = spark.table('base.sales')
                customers = spark.table('base.customers')
                summary = sales.join(customers, 'customer_id')
                summary.write.insertInto('rpt.sales_summary', overwrite=True)
                """);
        write("etl/dv_to_base.py", """
                # Output tables:
                #   base.sales
                hub = spark.table('dv.sales_hub')
                hub.write.insertInto('base.sales', overwrite=True)
                """);
        write("views/rpt.v_sales.sql", """
                CREATE OR REPLACE VIEW rpt.v_sales AS
                SELECT s.*, c.segment
                FROM rpt.sales_summary s
                JOIN base.customers c ON s.customer_id = c.customer_id
                """);
        write("sas/load_customers.sas", """
                %let srclib = src;
                proc sql;
                  create table base.customers as
                  select * from &srclib..customer_raw;
                quit;
                """);
        write("docs/readme.txt", "rpt.v_sales is documented elsewhere");
    }

    @Test
    void testTraceWritesEveryPathOfTheView() throws IOException {
        Path csv = outDir.resolve("lineage.csv");
        Path report = outDir.resolve("lineage.md");

        TraceResult result = new LineageTracer(TracerConfig.builder()
                .corpusRoot(corpusRoot)
                .target("rpt.v_sales")
                .outputCsv(csv)
                .reportPath(report)
                .build()).trace();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilesScanned()).isEqualTo(4);
        assertThat(chains(result.getLineages().get(0))).containsExactly(
                "rpt.v_sales <- base.customers <- src.customer_raw",
                "rpt.v_sales <- rpt.sales_summary <- base.customers <- src.customer_raw",
                "rpt.v_sales <- rpt.sales_summary <- base.sales <- dv.sales_hub");
        assertThat(result.truncatedTargets()).isZero();
        assertThat(result.cyclesCut()).isZero();

        LineageCsv written = new LineageCsvReader().read(csv);
        assertThat(written.getHeader()).containsExactly("Target Table", "Layer 1", "Layer 2", "Source Table");
        assertThat(written.getRows()).hasSize(3);
        Map<String, String> first = written.getRows().get(0);
        assertThat(LineageCsv.value(first, "Layer 1")).isEqualTo("base.customers");
        assertThat(LineageCsv.value(first, "Layer 2")).isEmpty();
        assertThat(LineageCsv.value(first, "Source Table")).isEqualTo("src.customer_raw");

        assertThat(Files.readString(report)).contains("## rpt.v_sales");
    }

    @Test
    void testBareTargetExpandsToQualifiedTables() {
        TraceResult result = new LineageTracer(TracerConfig.builder()
                .corpusRoot(corpusRoot)
                .target("sales_summary")
                .build()).trace();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLineages()).extracting(TargetLineage::getTarget)
                .containsExactly(TableName.require("rpt.sales_summary"));
        assertThat(result.getOutputCsv()).isNull();
    }

    @Test
    void testThreadCountDoesNotChangeOutput() {
        TracerConfig.TracerConfigBuilder base = TracerConfig.builder()
                .corpusRoot(corpusRoot)
                .target("rpt.v_sales")
                .target("rpt.sales_summary")
                .target("base.customers");

        TraceResult single = new LineageTracer(base.threads(1).build()).trace();
        TraceResult parallel = new LineageTracer(base.threads(4).build()).trace();

        assertThat(parallel.getTable().getRows()).isEqualTo(single.getTable().getRows());
        assertThat(parallel.getLineages()).extracting(TargetLineage::getTarget)
                .containsExactly(
                        TableName.require("rpt.v_sales"),
                        TableName.require("rpt.sales_summary"),
                        TableName.require("base.customers"));
    }

    @Test
    void testPathLimitTruncatesAndWarns() {
        TraceResult result = new LineageTracer(TracerConfig.builder()
                .corpusRoot(corpusRoot)
                .target("rpt.v_sales")
                .budget(EnumerationBudget.builder().maxPaths(1).build())
                .build()).trace();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.rowCount()).isEqualTo(1);
        assertThat(result.truncatedTargets()).isEqualTo(1);
        assertThat(result.getDiagnostics().getWarnings()).anyMatch(w -> w.contains("rpt.v_sales"));
    }

    @Test
    void testUnknownTargetsFailTheRun() {
        TraceResult result = new LineageTracer(TracerConfig.builder()
                .corpusRoot(corpusRoot)
                .target("nowhere_to_be_found")
                .build()).trace();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("No valid target tables");
    }

    @Test
    void testMissingCorpusFails() {
        TraceResult result = new LineageTracer(TracerConfig.builder()
                .corpusRoot(corpusRoot.resolve("missing"))
                .target("rpt.v_sales")
                .build()).trace();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("not a directory");
    }

    @Test
    void testMixedCaseSpellingsResolveToOneTable() throws IOException {
        Path mixed = outDir.resolve("mixed");
        write(mixed, "etl/load_sales.py", """
                # Output tables:
                #   RPT.Sales
                orders = spark.table('Base.Orders')
                orders.write.insertInto('RPT.Sales', overwrite=True)
                """);
        write(mixed, "etl/load_orders.py", """
                # Output tables:
                #   base.ORDERS
                raw = spark.table('SRC.RAW_ORDERS')
                raw.write.insertInto('base.ORDERS', overwrite=True)
                """);
        write(mixed, "sas/raw_orders.sas", """
                data SRC.RAW_ORDERS;
                  set lnd.feed;
                run;
                """);

        TraceResult result = new LineageTracer(TracerConfig.builder()
                .corpusRoot(mixed)
                .target("Rpt.SALES")
                .build()).trace();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getIndexedTables()).isEqualTo(3);
        assertThat(chains(result.getLineages().get(0)))
                .containsExactly("rpt.sales <- base.orders <- src.raw_orders <- lnd.feed");
    }

    @Test
    void testScriptTargetMappingSkipsSasPrograms() throws IOException {
        SourceCorpus corpus = SourceCorpus.scan(corpusRoot, new TraceDiagnostics());
        WriterIndex index = new WriterIndexBuilder(ExtractorRegistry.defaults()).build(corpus);

        List<ScriptTarget> mappings = new ScriptTargetMapper().map(corpus, index);

        assertThat(mappings).extracting(m -> m.getScript() + " -> " + m.getTarget()).containsExactly(
                "etl/base_to_report.py -> rpt.sales_summary",
                "etl/dv_to_base.py -> base.sales",
                "views/rpt.v_sales.sql -> rpt.v_sales");
    }

    @Test
    void testSasSummaryPerProgram() throws IOException {
        SourceCorpus corpus = SourceCorpus.scan(corpusRoot, new TraceDiagnostics());

        Map<String, SasTableSummary> summaries = new SasScriptAnalyzer(new SasProgramExtractor()).analyze(corpus);

        assertThat(summaries).containsOnlyKeys("sas/load_customers.sas");
        SasTableSummary summary = summaries.get("sas/load_customers.sas");
        assertThat(summary.inputs()).containsExactly(TableName.require("src.customer_raw"));
        assertThat(summary.outputs()).containsExactly(TableName.require("base.customers"));
    }

    private void write(String relative, String content) throws IOException {
        write(corpusRoot, relative, content);
    }

    private static void write(Path root, String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static List<String> chains(TargetLineage lineage) {
        return lineage.getPaths().stream().map(LineagePath::toString).toList();
    }
}
