package com.pipeline.lineage.tracer.expand;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.output.LineageCsv;
import com.pipeline.lineage.tracer.output.LineageFormatException;
import com.pipeline.lineage.tracer.shape.LineageTable;

/**
 * Promotes intermediate layer tables of a lineage CSV to target rows of their own.
 *
 * For every row and every non-empty {@code Layer i} whose table is not a target of the input
 * (case-insensitive), a row is added with that table as target, the following layers
 * renumbered from 1 and the same source. Output rows are grouped by target in first-seen order
 * and identical rows are written once. The column layout does not change.
 */
public class LayerExpander {
    private static final Logger log = LoggerFactory.getLogger(LayerExpander.class);

    private static final Pattern LAYER_COLUMN = Pattern.compile("^Layer\\s+(\\d+)$");

    /**
     * @throws LineageFormatException if the target or source column is missing
     */
    public LineageCsv expand(LineageCsv input) {
        List<String> header = input.getHeader();
        requireColumn(header, LineageTable.TARGET_COLUMN);
        requireColumn(header, LineageTable.SOURCE_COLUMN);

        List<String> layerColumns = layerColumns(header);
        if (layerColumns.isEmpty()) {
            log.info("No layer columns found. Nothing to expand.");
            return input;
        }
        log.debug("Detected layer columns: {}", layerColumns);

        // input targets come first, promoted layers after them
        Set<String> inputTargets = new HashSet<>();
        Map<String, List<Map<String, String>>> byTarget = new LinkedHashMap<>();
        for (Map<String, String> row : input.getRows()) {
            String target = LineageCsv.value(row, LineageTable.TARGET_COLUMN);
            byTarget.putIfAbsent(key(target), new ArrayList<>());
            if (!target.isEmpty()) {
                inputTargets.add(key(target));
            }
        }

        int promoted = 0;
        for (Map<String, String> row : input.getRows()) {
            String target = LineageCsv.value(row, LineageTable.TARGET_COLUMN);
            byTarget.get(key(target)).add(row);
            if (target.isEmpty()) {
                continue;
            }
            for (int i = 0; i < layerColumns.size(); i++) {
                String layer = LineageCsv.value(row, layerColumns.get(i));
                if (layer.isEmpty()) {
                    continue;
                }
                if (inputTargets.contains(key(layer))) {
                    log.debug("Layer '{}' already present as target. Skipping expansion.", layer);
                    continue;
                }
                byTarget.computeIfAbsent(key(layer), k -> new ArrayList<>())
                        .add(promote(row, header, layerColumns, i, layer));
                promoted++;
            }
        }

        List<Map<String, String>> out = new ArrayList<>();
        Set<List<String>> seenRows = new HashSet<>();
        for (List<Map<String, String>> group : byTarget.values()) {
            for (Map<String, String> row : group) {
                if (seenRows.add(cells(row, header))) {
                    out.add(row);
                } else {
                    log.debug("Skipping duplicate row {}", row);
                }
            }
        }
        log.info("Promoted {} layer row(s); {} row(s) after removing duplicates.", promoted, out.size());
        return new LineageCsv(header, out);
    }

    private static String key(String table) {
        return table.toLowerCase(Locale.ROOT);
    }

    private static List<String> cells(Map<String, String> row, List<String> header) {
        List<String> cells = new ArrayList<>(header.size());
        for (String column : header) {
            cells.add(LineageCsv.value(row, column));
        }
        return cells;
    }

    private static Map<String, String> promote(Map<String, String> row, List<String> header,
                                               List<String> layerColumns, int layerIndex, String layer) {
        Map<String, String> promoted = new LinkedHashMap<>();
        for (String column : header) {
            promoted.put(column, "");
        }
        promoted.put(LineageTable.TARGET_COLUMN, layer);

        int position = 1;
        for (String next : layerColumns.subList(layerIndex + 1, layerColumns.size())) {
            String value = LineageCsv.value(row, next);
            if (value.isEmpty()) {
                break;
            }
            String column = LineageTable.layerColumn(position++);
            if (promoted.containsKey(column)) {
                promoted.put(column, value);
            }
        }
        promoted.put(LineageTable.SOURCE_COLUMN, LineageCsv.value(row, LineageTable.SOURCE_COLUMN));
        return promoted;
    }

    /**
     * {@code Layer N} columns of the header, in numeric order.
     */
    static List<String> layerColumns(List<String> header) {
        return header.stream()
                .filter(column -> LAYER_COLUMN.matcher(column).matches())
                .sorted(Comparator.comparingInt(LayerExpander::layerNumber))
                .toList();
    }

    private static int layerNumber(String column) {
        Matcher m = LAYER_COLUMN.matcher(column);
        if (!m.matches()) {
            throw new LineageFormatException("Invalid layer column name: " + column);
        }
        return Integer.parseInt(m.group(1));
    }

    private static void requireColumn(List<String> header, String column) {
        if (!header.contains(column)) {
            throw new LineageFormatException("Input is missing required column: '" + column + "'");
        }
    }
}
