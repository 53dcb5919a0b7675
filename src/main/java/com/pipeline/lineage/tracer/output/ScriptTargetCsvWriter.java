package com.pipeline.lineage.tracer.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.pipeline.lineage.tracer.model.ScriptTarget;
import com.pipeline.lineage.util.FileWriteUtil;

/**
 * Writes the {@code script name,target table} mapping.
 */
public class ScriptTargetCsvWriter {
    private static final Logger log = LoggerFactory.getLogger(ScriptTargetCsvWriter.class);

    static final String SCRIPT_COLUMN = "script name";
    static final String TARGET_COLUMN = "target table";

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    public void write(List<ScriptTarget> mappings, Path out) throws IOException {
        if (mappings.isEmpty()) {
            log.warn("No mappings to write. CSV will only contain the header.");
        }
        CsvSchema schema = CsvSchema.builder()
                .addColumn(SCRIPT_COLUMN)
                .addColumn(TARGET_COLUMN)
                .build()
                .withHeader();

        FileWriteUtil.createParentDirectories(out);
        try (BufferedWriter writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
             SequenceWriter rows = mapper.writer(schema).writeValues(writer)) {
            for (ScriptTarget mapping : mappings) {
                Map<String, String> row = new LinkedHashMap<>();
                row.put(SCRIPT_COLUMN, mapping.getScript());
                row.put(TARGET_COLUMN, mapping.getTarget().getCanonical());
                rows.write(row);
            }
        }
        log.info("Wrote mapping CSV with {} rows to {}", mappings.size(), out);
    }
}
