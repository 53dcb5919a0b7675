package com.pipeline.lineage.cli.model;

import java.nio.file.Path;

import com.pipeline.lineage.tracer.resolve.EnumerationBudget;
import com.pipeline.lineage.tracer.resolve.StandardResolutionPolicy;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "trace" command. No validation, no execution logic, no printing.
 */
@Getter
public class TraceOptions {

	@Option(names = { "--root", "-r" }, required = true, description = "Root folder of the pipeline source corpus")
	private Path root;

	@Option(names = { "--targets", "-t" }, description = "Comma separated target tables (schema.table or bare table name)")
	private String targets;

	@Option(names = { "--targets-file" }, description = "File with target tables, one per line or comma separated; '#' starts a comment")
	private Path targetsFile;

	@Option(names = { "--out", "-o" }, required = true, description = "Destination lineage CSV")
	private Path out;

	@Option(names = { "--report" }, description = "Optional Markdown report destination")
	private Path report;

	@Option(names = { "--max-paths" }, defaultValue = "" + EnumerationBudget.DEFAULT_MAX_PATHS, description = "Maximum paths per target (default: ${DEFAULT-VALUE})")
	private int maxPaths;

	@Option(names = { "--max-depth" }, defaultValue = "" + EnumerationBudget.DEFAULT_MAX_DEPTH, description = "Maximum tables on one path (default: ${DEFAULT-VALUE})")
	private int maxDepth;

	@Option(names = { "--timeout-seconds" }, defaultValue = "0", description = "Wall-clock limit per target in seconds, 0 for none")
	private long timeoutSeconds;

	@Option(names = { "--threads" }, defaultValue = "1", description = "Targets traced in parallel (default: ${DEFAULT-VALUE})")
	private int threads;

	@Option(names = { "--writer-policy" }, defaultValue = "UNION", description = "How upstreams of ambiguous writers combine: ${COMPLETION-CANDIDATES}")
	private StandardResolutionPolicy writerPolicy;

	@Option(names = { "--log-level" }, defaultValue = "INFO", description = "Logging verbosity: TRACE, DEBUG, INFO, WARN, ERROR")
	private String logLevel;
}
