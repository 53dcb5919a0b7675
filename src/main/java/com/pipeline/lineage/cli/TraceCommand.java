package com.pipeline.lineage.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.cli.exception.OptionsValidationException;
import com.pipeline.lineage.cli.model.TraceOptions;
import com.pipeline.lineage.cli.model.ValidatedTraceOptions;
import com.pipeline.lineage.cli.output.TraceResultsPrinter;
import com.pipeline.lineage.cli.validation.TraceOptionsValidator;
import com.pipeline.lineage.tracer.LineageTracer;
import com.pipeline.lineage.tracer.TraceResult;
import com.pipeline.lineage.tracer.TracerConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that traces the upstream lineage of target tables into a CSV.
 */
@Command(
        name = "trace",
        mixinStandardHelpOptions = true,
        description = "Traces every upstream lineage path of the target tables and writes them as CSV."
)
public class TraceCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TraceCommand.class);

    @Mixin
    private TraceOptions options;

    private final TraceOptionsValidator validator = new TraceOptionsValidator();
    private final TraceResultsPrinter printer = new TraceResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedTraceOptions validated = validator.validate(options);
            LogLevels.apply(options.getLogLevel());

            printer.printBanner(options, validated);

            TracerConfig config = TracerConfig.builder()
                    .corpusRoot(validated.getCorpusRoot())
                    .targets(validated.getTargets())
                    .outputCsv(options.getOut())
                    .reportPath(options.getReport())
                    .budget(validated.getBudget())
                    .threads(options.getThreads())
                    .writerPolicy(options.getWriterPolicy())
                    .build();

            TraceResult result = new LineageTracer(config).trace();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(result);
            return 0;

        } catch (OptionsValidationException e) {
            log.error("{} invalid option(s) for '{}':", e.getErrors().size(), e.getCommand());
            e.getErrors().forEach(error -> log.error("  - {}", error));
            return 1;
        } catch (Exception e) {
            log.error("Tracing failed with exception", e);
            return 1;
        }
    }
}
