package com.pipeline.lineage.tracer.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

/**
 * Reads a lineage CSV, keeping the header order. A leading byte order mark is ignored.
 */
public class LineageCsvReader {

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    /**
     * @throws LineageFormatException if the file has no header row
     */
    public LineageCsv read(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }

        List<String[]> records;
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(text)) {
            records = it.readAll();
        }
        if (records.isEmpty()) {
            throw new LineageFormatException("Input CSV is missing a header row: " + file);
        }

        List<String> header = Arrays.stream(records.get(0)).map(String::strip).toList();
        List<Map<String, String>> rows = new ArrayList<>(records.size() - 1);
        for (String[] cells : records.subList(1, records.size())) {
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                row.put(header.get(i), i < cells.length ? cells[i] : "");
            }
            rows.add(row);
        }
        return new LineageCsv(header, rows);
    }
}
