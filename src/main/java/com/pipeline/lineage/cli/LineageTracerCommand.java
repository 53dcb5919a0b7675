package com.pipeline.lineage.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; running it without a subcommand prints usage.
 */
@Command(
        name = "lineage-tracer",
        mixinStandardHelpOptions = true,
        version = "pipeline-lineage-tracer 1.0.0",
        description = "Discovers the upstream table lineage of Spark, SQL view and SAS pipelines.",
        subcommands = {
                TraceCommand.class,
                ScriptTargetsCommand.class,
                ExpandLayersCommand.class,
                SasReportCommand.class
        }
)
public class LineageTracerCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
