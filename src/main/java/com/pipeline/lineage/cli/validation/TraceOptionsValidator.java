package com.pipeline.lineage.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.pipeline.lineage.cli.LogLevels;
import com.pipeline.lineage.cli.exception.OptionsValidationException;
import com.pipeline.lineage.cli.model.TraceOptions;
import com.pipeline.lineage.cli.model.ValidatedTraceOptions;
import com.pipeline.lineage.tracer.TargetNameExpander;
import com.pipeline.lineage.tracer.resolve.EnumerationBudget;

public class TraceOptionsValidator {

	public ValidatedTraceOptions validate(TraceOptions o) {
		List<String> errors = new ArrayList<>();

		if (!existsDirectory(o.getRoot())) {
			errors.add("Corpus root does not exist or is not a directory: " + o.getRoot());
		}

		Set<String> targets = new LinkedHashSet<>(TargetNameExpander.splitTargets(o.getTargets()));
		if (o.getTargetsFile() != null) {
			targets.addAll(readTargetsFile(o.getTargetsFile(), errors));
		}
		if (targets.isEmpty()) {
			errors.add("At least one target is required (--targets / --targets-file).");
		}

		if (o.getMaxPaths() <= 0) {
			errors.add("--max-paths must be > 0. Got: " + o.getMaxPaths());
		}
		if (o.getMaxDepth() <= 0) {
			errors.add("--max-depth must be > 0. Got: " + o.getMaxDepth());
		}
		if (o.getTimeoutSeconds() < 0) {
			errors.add("--timeout-seconds must be >= 0. Got: " + o.getTimeoutSeconds());
		}
		if (o.getThreads() <= 0) {
			errors.add("--threads must be > 0. Got: " + o.getThreads());
		}
		if (!LogLevels.isValid(o.getLogLevel())) {
			errors.add("Unknown log level: " + o.getLogLevel());
		}
		if (o.getOut() != null && Files.isDirectory(o.getOut())) {
			errors.add("Output path is a directory: " + o.getOut());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException("trace", errors);
		}

		EnumerationBudget budget = EnumerationBudget.builder()
				.maxPaths(o.getMaxPaths())
				.maxDepth(o.getMaxDepth())
				.timeout(o.getTimeoutSeconds() > 0 ? Duration.ofSeconds(o.getTimeoutSeconds()) : null)
				.build();

		return new ValidatedTraceOptions(o.getRoot().toAbsolutePath().normalize(), List.copyOf(targets), budget);
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static List<String> readTargetsFile(Path file, List<String> errors) {
		if (!Files.isRegularFile(file)) {
			errors.add("Targets file does not exist: " + file);
			return List.of();
		}
		try {
			List<String> targets = new ArrayList<>();
			for (String line : Files.readAllLines(file)) {
				String content = line.strip();
				if (content.isEmpty() || content.startsWith("#")) {
					continue;
				}
				targets.addAll(TargetNameExpander.splitTargets(content));
			}
			return targets;
		} catch (IOException e) {
			errors.add("Failed to read targets file " + file + ": " + e.getMessage());
			return List.of();
		}
	}
}
