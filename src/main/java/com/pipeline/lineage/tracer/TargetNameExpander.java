package com.pipeline.lineage.tracer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.index.WriterIndex;
import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.TraceDiagnostics;

import lombok.RequiredArgsConstructor;

/**
 * Turns requested target names into canonical tables.
 *
 * A name containing a dot is canonicalized as is. A bare name expands to every indexed
 * qualified table with that table part; when there is none, an indexed bare table of the same
 * name is used. Duplicates keep their first position.
 */
@RequiredArgsConstructor
public class TargetNameExpander {
    private static final Logger log = LoggerFactory.getLogger(TargetNameExpander.class);

    private final WriterIndex index;
    private final TraceDiagnostics diagnostics;

    public List<TableName> expand(List<String> requested) {
        Set<TableName> targets = new LinkedHashSet<>();
        for (String raw : requested) {
            String name = raw.strip();
            if (name.isEmpty()) {
                continue;
            }
            if (name.contains(".")) {
                Optional<TableName> table = TableName.parse(name);
                if (table.isPresent()) {
                    targets.add(table.get());
                } else {
                    unresolved("Target '" + name + "' is not a valid table name. Skipping.");
                }
                continue;
            }

            List<TableName> matches = index.qualifiedMatches(name.toLowerCase(Locale.ROOT));
            if (!matches.isEmpty()) {
                log.info("Expanded target '{}' to {}", name, matches);
                targets.addAll(matches);
                continue;
            }
            Optional<TableName> bare = TableName.parse(name).filter(index::contains);
            if (bare.isPresent()) {
                targets.add(bare.get());
            } else {
                unresolved("Could not resolve target '" + name + "' to any indexed table. Skipping.");
            }
        }
        return new ArrayList<>(targets);
    }

    /**
     * Splits a comma separated target list.
     */
    public static List<String> splitTargets(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private void unresolved(String message) {
        diagnostics.getWarnings().add(message);
        log.warn(message);
    }
}
