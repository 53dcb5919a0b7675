package com.pipeline.lineage.tracer.extract;

import com.pipeline.lineage.tracer.model.TableName;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SparkScriptExtractorTest {

    private final SparkScriptExtractor extractor = new SparkScriptExtractor();

    @Test
    void testOutputSectionOfHeaderComment() {
        String script = """
                ##########################################
                # Job: base to report
                # Output tables:
                #   rpt.sales_summary
                #   rpt.sales_daily, rpt.sales_weekly
                # Input tables:
                #   base.sales
                ##########################################
                from pyspark.sql import SparkSession
                """;

        assertThat(extractor.writtenTables(script)).containsExactly(
                TableName.require("rpt.sales_daily"),
                TableName.require("rpt.sales_summary"),
                TableName.require("rpt.sales_weekly"));
    }

    @Test
    void testSectionStopsAtFirstCodeLine() {
        String script = """
                # Output table
                #   rpt.one
                spark = None
                # rpt.not_an_output
                """;

        assertThat(extractor.writtenTables(script)).containsExactly(TableName.require("rpt.one"));
    }

    @Test
    void testInsertIntoTargetsAreWrites() {
        String script = """
                df = spark.table('base.sales')
                df.write.insertInto("RPT.Sales_Summary", overwrite=True)
                """;

        assertThat(extractor.writtenTables(script)).containsExactly(TableName.require("rpt.sales_summary"));
    }

    @Test
    void testSparkTableCallsAreReads() {
        String script = """
                sales = spark.table('base.sales')
                customers = spark.table( "base.customers" )
                lookup = spark.table('lookup')
                """;

        assertThat(extractor.readTables(script)).containsExactly(
                TableName.require("base.customers"),
                TableName.require("base.sales"));
    }
}
