package com.pipeline.lineage.tracer.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.pipeline.lineage.tracer.model.LineageRow;
import com.pipeline.lineage.tracer.shape.LineageTable;

/**
 * Column-ordered, string-valued view of a lineage CSV file.
 */
public class LineageCsv {

    private final List<String> header;
    private final List<Map<String, String>> rows;

    public LineageCsv(List<String> header, List<Map<String, String>> rows) {
        this.header = List.copyOf(header);
        List<Map<String, String>> copy = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static LineageCsv of(LineageTable table) {
        List<String> header = table.header();
        List<Map<String, String>> rows = new ArrayList<>(table.getRows().size());
        for (LineageRow row : table.getRows()) {
            List<String> cells = table.cells(row);
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                values.put(header.get(i), cells.get(i));
            }
            rows.add(values);
        }
        return new LineageCsv(header, rows);
    }

    public List<String> getHeader() {
        return header;
    }

    public List<Map<String, String>> getRows() {
        return rows;
    }

    /**
     * Cell value, trimmed; empty when the column is absent or blank.
     */
    public static String value(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null ? "" : value.strip();
    }
}
