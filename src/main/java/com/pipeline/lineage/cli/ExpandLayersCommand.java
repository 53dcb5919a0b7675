package com.pipeline.lineage.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.expand.LayerExpander;
import com.pipeline.lineage.tracer.output.LineageCsv;
import com.pipeline.lineage.tracer.output.LineageCsvReader;
import com.pipeline.lineage.tracer.output.LineageCsvWriter;
import com.pipeline.lineage.tracer.output.LineageFormatException;
import com.pipeline.lineage.util.FileWriteUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command that promotes intermediate layer tables of a lineage CSV to targets.
 */
@Command(
        name = "expand-layers",
        mixinStandardHelpOptions = true,
        description = "Adds a row for every layer table that is not yet a target, keeping its downstream chain."
)
public class ExpandLayersCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExpandLayersCommand.class);

    @Option(names = {"--input", "-i"}, required = true, description = "Lineage CSV produced by the trace command")
    private Path input;

    @Option(names = {"--output", "-o"}, description = "Destination CSV (default: <input>_expanded.csv)")
    private Path output;

    @Option(names = {"--log-level"}, defaultValue = "INFO", description = "Logging verbosity: TRACE, DEBUG, INFO, WARN, ERROR")
    private String logLevel;

    @Override
    public Integer call() {
        try {
            if (!Files.isRegularFile(input)) {
                log.error("Input CSV not found: {}", input);
                return 1;
            }
            LogLevels.apply(logLevel);

            Path destination = output != null ? output : FileWriteUtil.withStemSuffix(input, "_expanded", ".csv");

            LineageCsv lineage = new LineageCsvReader().read(input);
            log.info("Loaded {} row(s) from {}", lineage.getRows().size(), input);

            LineageCsv expanded = new LayerExpander().expand(lineage);
            new LineageCsvWriter().write(expanded, destination);
            return 0;

        } catch (LineageFormatException e) {
            log.error(e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Layer expansion failed with exception", e);
            return 1;
        }
    }
}
