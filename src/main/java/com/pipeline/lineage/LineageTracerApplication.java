package com.pipeline.lineage;

import com.pipeline.lineage.cli.LineageTracerCommand;

import picocli.CommandLine;

/**
 * Main entry point for the Pipeline Lineage Tracer.
 */
public class LineageTracerApplication {

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new LineageTracerCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
