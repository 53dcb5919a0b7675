package com.pipeline.lineage.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.corpus.SourceCorpus;
import com.pipeline.lineage.tracer.extract.ExtractorRegistry;
import com.pipeline.lineage.tracer.index.ScriptTargetMapper;
import com.pipeline.lineage.tracer.index.WriterIndex;
import com.pipeline.lineage.tracer.index.WriterIndexBuilder;
import com.pipeline.lineage.tracer.model.ScriptTarget;
import com.pipeline.lineage.tracer.model.TraceDiagnostics;
import com.pipeline.lineage.tracer.output.ScriptTargetCsvWriter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command that lists which script produces which table.
 */
@Command(
        name = "script-targets",
        mixinStandardHelpOptions = true,
        description = "Writes a CSV mapping each Spark script and view definition to the tables it produces."
)
public class ScriptTargetsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScriptTargetsCommand.class);

    @Option(names = {"--root", "-r"}, required = true, description = "Root folder to scan")
    private Path root;

    @Option(names = {"--out", "-o"}, defaultValue = "script_target_mapping.csv", description = "Destination CSV (default: ${DEFAULT-VALUE})")
    private Path out;

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

            Path normalizedRoot = root.toAbsolutePath().normalize();
            SourceCorpus corpus = SourceCorpus.scan(normalizedRoot, new TraceDiagnostics());
            log.info("Scanning {} candidate files under {}", corpus.size(), normalizedRoot);

            WriterIndex index = new WriterIndexBuilder(ExtractorRegistry.defaults()).build(corpus);
            List<ScriptTarget> mappings = new ScriptTargetMapper().map(corpus, index);
            new ScriptTargetCsvWriter().write(mappings, out);
            return 0;

        } catch (Exception e) {
            log.error("Mapping failed with exception", e);
            return 1;
        }
    }
}
