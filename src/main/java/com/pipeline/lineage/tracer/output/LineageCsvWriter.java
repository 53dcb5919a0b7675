package com.pipeline.lineage.tracer.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.pipeline.lineage.tracer.shape.LineageTable;
import com.pipeline.lineage.util.FileWriteUtil;

/**
 * Writes lineage rows as UTF-8 CSV with a header row, keeping the given column order.
 */
public class LineageCsvWriter {
    private static final Logger log = LoggerFactory.getLogger(LineageCsvWriter.class);

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    public void write(LineageTable table, Path out) throws IOException {
        write(LineageCsv.of(table), out);
    }

    public void write(LineageCsv csv, Path out) throws IOException {
        CsvSchema.Builder schema = CsvSchema.builder();
        for (String column : csv.getHeader()) {
            schema.addColumn(column);
        }

        FileWriteUtil.createParentDirectories(out);
        try (BufferedWriter writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
             SequenceWriter rows = mapper.writer(schema.build().withHeader()).writeValues(writer)) {
            for (Map<String, String> row : csv.getRows()) {
                rows.write(row);
            }
        }
        log.info("Wrote {} row(s) to {}", csv.getRows().size(), out);
    }
}
