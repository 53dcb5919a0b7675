package com.pipeline.lineage.tracer.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class TableNameTest {

    @Test
    void testQualifiedNameIsLowerCased() {
        TableName name = TableName.require("  ADS.Sales_Summary ");

        assertThat(name.getCanonical()).isEqualTo("ads.sales_summary");
        assertThat(name.getSchema()).isEqualTo("ads");
        assertThat(name.getTable()).isEqualTo("sales_summary");
        assertThat(name.isQualified()).isTrue();
    }

    @Test
    void testPunctuationQuotesAndDatasetOptionsAreStripped() {
        assertThat(TableName.parse("'db.tbl';")).contains(TableName.of("db", "tbl"));
        assertThat(TableName.parse("db.tbl(keep=a b)")).contains(TableName.of("db", "tbl"));
        assertThat(TableName.parse("db.tbl / view=v")).contains(TableName.of("db", "tbl"));
        assertThat(TableName.parse("db.tbl.")).contains(TableName.of("db", "tbl"));
        assertThat(TableName.parse("\"db.tbl\",")).contains(TableName.of("db", "tbl"));
    }

    @Test
    void testBareNameStaysBare() {
        TableName bare = TableName.require("Staging_Customers");

        assertThat(bare.getCanonical()).isEqualTo("staging_customers");
        assertThat(bare.isQualified()).isFalse();
        assertThat(bare).isNotEqualTo(TableName.require("work.staging_customers"));
    }

    @Test
    void testUnresolvableTokensHaveNoIdentity() {
        assertThat(TableName.parse("&lib..customers")).isEmpty();
        assertThat(TableName.parse("_null_")).isEmpty();
        assertThat(TableName.parse("x")).isEmpty();
        assertThat(TableName.parse("2024")).isEmpty();
        assertThat(TableName.parse("select")).isEmpty();
        assertThat(TableName.parse("WORK")).isEmpty();
        assertThat(TableName.parse("")).isEmpty();
        assertThat(TableName.parse(null)).isEmpty();
        assertThat(TableName.parse("a.b.c")).isEmpty();
        assertThat(TableName.parse("db-prod.tbl")).isEmpty();
    }

    @Test
    void testEqualityAndOrderingUseCanonicalForm() {
        Optional<TableName> upper = TableName.parse("DB.TBL");
        Optional<TableName> lower = TableName.parse("db.tbl");

        assertThat(upper).isEqualTo(lower);
        assertThat(upper.get().hashCode()).isEqualTo(lower.get().hashCode());
        assertThat(TableName.require("db.a").compareTo(TableName.require("db.b"))).isNegative();
        assertThat(TableName.require("db.tbl")).hasToString("db.tbl");
    }

    @Test
    void testRequireRejectsInvalidName() {
        assertThatThrownBy(() -> TableName.require("from"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("from");
    }
}
