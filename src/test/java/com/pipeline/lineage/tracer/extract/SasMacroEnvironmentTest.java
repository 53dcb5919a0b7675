package com.pipeline.lineage.tracer.extract;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SasMacroEnvironmentTest {

    @Test
    void testAssignmentsAreEvaluatedInOrder() {
        String text = """
                %let lib = udp_src;
                %let tbl = &lib..customers;
                """;

        Map<String, String> assigned = SasMacroEnvironment.empty().assignmentsIn(text);

        assertThat(assigned).containsEntry("lib", "udp_src").containsEntry("tbl", "udp_src.customers");
    }

    @Test
    void testExpandsDottedAndPlainReferences() {
        SasMacroEnvironment env = SasMacroEnvironment.of(Map.of("LIB", "ads", "name", "orders"));

        assertThat(env.expand("&lib..&name")).isEqualTo("ads.orders");
        assertThat(env.expand("&lib..&name._hist")).isEqualTo("ads.orders_hist");
    }

    @Test
    void testUnknownReferencesStayInPlace() {
        assertThat(SasMacroEnvironment.empty().expand("&unknown..tbl")).isEqualTo("&unknown.tbl");
    }

    @Test
    void testNestedReferencesExpandWithinPassLimit() {
        SasMacroEnvironment env = SasMacroEnvironment.of(Map.of("a", "&b", "b", "&c", "c", "db.final"));

        assertThat(env.expand("&a")).isEqualTo("db.final");
    }

    @Test
    void testQuotingFunctionsAndQuotesAreSanitized() {
        assertThat(SasMacroEnvironment.sanitize(" 'db.tbl' ")).isEqualTo("db.tbl");
        assertThat(SasMacroEnvironment.sanitize("%str(db.tbl)")).isEqualTo("db.tbl");
        assertThat(SasMacroEnvironment.sanitize("%NRSTR(\"db.tbl\")")).isEqualTo("\"db.tbl\"");
    }

    @Test
    void testWithReturnsNewSnapshot() {
        SasMacroEnvironment base = SasMacroEnvironment.of(Map.of("lib", "a_lib"));
        SasMacroEnvironment updated = base.with(Map.of("lib", "b_lib"));

        assertThat(base.get("lib")).isEqualTo("a_lib");
        assertThat(updated.get("LIB")).isEqualTo("b_lib");
    }
}
