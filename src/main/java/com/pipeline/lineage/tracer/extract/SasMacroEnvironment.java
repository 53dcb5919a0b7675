package com.pipeline.lineage.tracer.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable snapshot of SAS macro variables ({@code %LET name = value;}).
 *
 * Every evaluation returns a new snapshot; names are case-insensitive and stored lower-case.
 */
public final class SasMacroEnvironment {

    private static final Pattern ASSIGNMENT = Pattern.compile(
            "%let\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*([^;]*);", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOTTED_REFERENCE = Pattern.compile("&([A-Za-z0-9_]+)\\.");
    private static final Pattern REFERENCE = Pattern.compile("&([A-Za-z0-9_]+)");
    private static final String[] QUOTING_FUNCTIONS = {"%str", "%nrstr", "%upcase", "%quote", "%nrquote"};

    static final int MAX_EXPANSION_PASSES = 5;

    private static final SasMacroEnvironment EMPTY = new SasMacroEnvironment(Map.of());

    private final Map<String, String> variables;

    private SasMacroEnvironment(Map<String, String> variables) {
        this.variables = variables;
    }

    public static SasMacroEnvironment empty() {
        return EMPTY;
    }

    public static SasMacroEnvironment of(Map<String, String> variables) {
        Map<String, String> copy = new LinkedHashMap<>();
        variables.forEach((k, v) -> copy.put(k.toLowerCase(Locale.ROOT), v));
        return new SasMacroEnvironment(Collections.unmodifiableMap(copy));
    }

    public Map<String, String> variables() {
        return variables;
    }

    public String get(String name) {
        return variables.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Snapshot with {@code updates} layered over this one.
     */
    public SasMacroEnvironment with(Map<String, String> updates) {
        if (updates.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(variables);
        updates.forEach((k, v) -> merged.put(k.toLowerCase(Locale.ROOT), v));
        return new SasMacroEnvironment(Collections.unmodifiableMap(merged));
    }

    /**
     * Evaluates the {@code %LET} statements of {@code text} in order. Each right-hand side is
     * expanded against this snapshot plus the assignments already seen in the same text.
     *
     * @return only the variables assigned in {@code text}
     */
    public Map<String, String> assignmentsIn(String text) {
        Map<String, String> updates = new LinkedHashMap<>();
        Matcher m = ASSIGNMENT.matcher(text);
        while (m.find()) {
            String name = m.group(1).toLowerCase(Locale.ROOT);
            String expanded = with(updates).expand(m.group(2));
            updates.put(name, sanitize(expanded));
        }
        return updates;
    }

    /**
     * Expands {@code &name.} and {@code &name} references, repeating for nested references.
     * Unknown references are left in place.
     */
    public String expand(String text) {
        String current = text;
        for (int pass = 0; pass < MAX_EXPANSION_PASSES; pass++) {
            boolean[] changed = {false};
            String next = replaceKnown(DOTTED_REFERENCE, current, changed);
            next = replaceKnown(REFERENCE, next, changed);
            next = next.replace("..", ".");
            current = next;
            if (!changed[0]) {
                break;
            }
        }
        return current;
    }

    private String replaceKnown(Pattern pattern, String text, boolean[] changed) {
        return pattern.matcher(text).replaceAll(match -> {
            String value = variables.get(match.group(1).toLowerCase(Locale.ROOT));
            if (value == null) {
                return Matcher.quoteReplacement(match.group());
            }
            changed[0] = true;
            return Matcher.quoteReplacement(value);
        });
    }

    static String sanitize(String raw) {
        String value = raw.strip();
        while (value.length() >= 2 && value.charAt(0) == value.charAt(value.length() - 1)
                && (value.charAt(0) == '\'' || value.charAt(0) == '"')) {
            value = value.substring(1, value.length() - 1).strip();
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (String function : QUOTING_FUNCTIONS) {
            if (lower.startsWith(function + "(") && value.endsWith(")")) {
                value = value.substring(function.length() + 1, value.length() - 1).strip();
                break;
            }
        }
        return value.strip();
    }

    @Override
    public String toString() {
        return variables.toString();
    }
}
