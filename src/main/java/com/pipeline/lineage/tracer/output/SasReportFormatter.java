package com.pipeline.lineage.tracer.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.pipeline.lineage.tracer.extract.SasTableSummary;
import com.pipeline.lineage.tracer.model.TableName;

/**
 * Plain-text report of the input, intermediate and output tables of each SAS program.
 */
public class SasReportFormatter {

    private static final String INDENT = "    ";

    public List<String> format(Map<String, SasTableSummary> summaries) {
        List<String> lines = new ArrayList<>();
        if (summaries.isEmpty()) {
            lines.add("No SAS files found.");
            return lines;
        }
        for (Map.Entry<String, SasTableSummary> entry : summaries.entrySet()) {
            SasTableSummary summary = entry.getValue();
            lines.add("=== " + entry.getKey() + " ===");
            appendTables(lines, "Input Tables", summary.inputs());
            appendTables(lines, "Intermediate Tables", summary.intermediates());
            appendTables(lines, "Output Tables", summary.outputs());
            lines.add("");
        }
        return lines;
    }

    private static void appendTables(List<String> lines, String title, Set<TableName> tables) {
        lines.add(title + ":");
        if (tables.isEmpty()) {
            lines.add(INDENT + "(none)");
            return;
        }
        for (TableName table : tables) {
            lines.add(INDENT + "- " + table);
        }
    }
}
