package com.pipeline.lineage.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.corpus.SourceCorpus;
import com.pipeline.lineage.tracer.extract.SasProgramExtractor;
import com.pipeline.lineage.tracer.extract.SasScriptAnalyzer;
import com.pipeline.lineage.tracer.extract.SasTableSummary;
import com.pipeline.lineage.tracer.model.TraceDiagnostics;
import com.pipeline.lineage.tracer.output.SasReportFormatter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints the input, intermediate and output tables of every SAS program.
 */
@Command(
        name = "sas-report",
        mixinStandardHelpOptions = true,
        description = "Prints the tables each SAS program reads, uses internally and produces."
)
public class SasReportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SasReportCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"--root", "-r"}, required = true, description = "Root folder containing .sas files")
    private Path root;

    @Option(names = {"--log-level"}, defaultValue = "INFO", description = "Logging verbosity: TRACE, DEBUG, INFO, WARN, ERROR")
    private String logLevel;

    @Override
    public Integer call() {
        try {
            if (!Files.isDirectory(root)) {
                log.error("Root does not exist or is not a directory: {}", root);
                return 1;
            }
            LogLevels.apply(logLevel);

            SourceCorpus corpus = SourceCorpus.scan(root.toAbsolutePath().normalize(), new TraceDiagnostics());
            Map<String, SasTableSummary> summaries = new SasScriptAnalyzer(new SasProgramExtractor()).analyze(corpus);

            PrintWriter out = spec.commandLine().getOut();
            new SasReportFormatter().format(summaries).forEach(out::println);
            out.flush();
            return 0;

        } catch (Exception e) {
            log.error("SAS analysis failed with exception", e);
            return 1;
        }
    }
}
