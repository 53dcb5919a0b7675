package com.pipeline.lineage.tracer.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Canonical identity of a table: {@code schema.table} or a bare name, always lower-case.
 *
 * A bare name is its own identity and never equals a qualified one.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TableName implements Comparable<TableName> {

    private static final Pattern QUALIFIED = Pattern.compile("^([a-z0-9_]+)\\.([a-z0-9_]+)$");
    private static final Pattern BARE = Pattern.compile("^([a-z0-9_]+)$");

    static final Set<String> RESERVED_WORDS = Set.of(
            "a", "b", "by", "case", "connect", "connection", "create", "data", "delete", "do", "else",
            "end", "false", "format", "from", "group", "having", "if", "in", "index", "inner", "into",
            "join", "label", "keep", "left", "length", "libname", "missing", "not", "null", "on",
            "options", "or", "order", "outer", "proc", "put", "quit", "rename", "right", "run",
            "select", "set", "table", "then", "to", "true", "update", "values", "view", "where",
            "while", "with", "work", "hadoop", "regexp_replace", "eof", "out", "input", "output",
            "name", "type", "noprint"
    );

    @EqualsAndHashCode.Include
    private final String canonical;
    private final String schema;
    private final String table;

    /**
     * Canonicalizes a raw token taken from source text.
     *
     * @return the identity, or empty when the token cannot be confidently read as a table
     */
    public static Optional<TableName> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String cleaned = token.strip();
        cleaned = stripTrailing(cleaned, ";,");
        cleaned = cutAt(cleaned, '/');
        cleaned = cutAt(cleaned, '(');
        cleaned = stripQuotes(cleaned.strip());
        cleaned = stripTrailing(cleaned, ".");
        cleaned = cleaned.strip().toLowerCase(Locale.ROOT);

        if (cleaned.isEmpty() || cleaned.contains("&") || cleaned.equals("_null_")) {
            return Optional.empty();
        }

        Matcher qualified = QUALIFIED.matcher(cleaned);
        if (qualified.matches()) {
            return Optional.of(of(qualified.group(1), qualified.group(2)));
        }

        if (BARE.matcher(cleaned).matches()) {
            if (cleaned.length() == 1 || isNumeral(cleaned) || RESERVED_WORDS.contains(cleaned)) {
                return Optional.empty();
            }
            return Optional.of(new TableName(cleaned, null, cleaned));
        }
        return Optional.empty();
    }

    /**
     * Builds a qualified name from already separated parts.
     */
    public static TableName of(String schema, String table) {
        String s = schema.strip().toLowerCase(Locale.ROOT);
        String t = table.strip().toLowerCase(Locale.ROOT);
        return new TableName(s + "." + t, s, t);
    }

    /**
     * Parses a name that is expected to be valid, e.g. a CLI target or a test fixture.
     *
     * @throws IllegalArgumentException if the name cannot be canonicalized
     */
    public static TableName require(String token) {
        return parse(token).orElseThrow(() -> new IllegalArgumentException("Not a table name: " + token));
    }

    public boolean isQualified() {
        return schema != null;
    }

    @Override
    public int compareTo(TableName other) {
        return canonical.compareTo(other.canonical);
    }

    @Override
    public String toString() {
        return canonical;
    }

    private static boolean isNumeral(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String cutAt(String s, char c) {
        int idx = s.indexOf(c);
        return idx >= 0 ? s.substring(0, idx) : s;
    }

    private static String stripTrailing(String s, String chars) {
        int end = s.length();
        while (end > 0 && chars.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(0, end);
    }

    private static String stripQuotes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) == '\'' || s.charAt(start) == '"')) {
            start++;
        }
        while (end > start && (s.charAt(end - 1) == '\'' || s.charAt(end - 1) == '"')) {
            end--;
        }
        return s.substring(start, end);
    }
}
