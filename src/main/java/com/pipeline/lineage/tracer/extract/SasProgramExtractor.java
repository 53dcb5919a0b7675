package com.pipeline.lineage.tracer.extract;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.WriterKind;

/**
 * SAS programs, evaluated block by block.
 *
 * Macro variables flow as an immutable {@link SasMacroEnvironment}: assignments before a block
 * and inside it produce the snapshot the block is expanded with, and that snapshot carries on
 * to the following blocks.
 */
public class SasProgramExtractor implements TableExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern CREATE_TABLE = Pattern.compile("\\bcreate\\s+table\\s+([A-Za-z0-9_.&]+)", FLAGS);
    private static final Pattern INSERT_INTO = Pattern.compile("\\binsert\\s+into\\s+([A-Za-z0-9_.&]+)", FLAGS);
    private static final Pattern FROM = Pattern.compile("\\bfrom\\s+([A-Za-z0-9_.&]+)", FLAGS);
    private static final Pattern JOIN = Pattern.compile("\\bjoin\\s+([A-Za-z0-9_.&]+)", FLAGS);
    private static final Pattern DATA_STATEMENT = Pattern.compile(
            "^\\s*data(?!\\s*=)\\s+([^;]+);", FLAGS | Pattern.MULTILINE);
    private static final Pattern SET_STATEMENT = Pattern.compile(
            "^\\s*set(?!\\s*=)\\s+([^;]+);", FLAGS | Pattern.MULTILINE);
    private static final Pattern UPDATE = Pattern.compile("\\bupdate\\s+([A-Za-z0-9_.&]+)", FLAGS);
    private static final Pattern OUT_OPTION = Pattern.compile("\\bout\\s*=\\s*([A-Za-z0-9_.&]+)", FLAGS);
    private static final Pattern BASE_OPTION = Pattern.compile("\\bbase\\s*=\\s*([A-Za-z0-9_.&]+)", FLAGS);
    private static final Pattern DATA_OPTION = Pattern.compile("\\bdata\\s*=\\s*([A-Za-z0-9_.&]+)", FLAGS);

    private final SasBlockSplitter splitter = new SasBlockSplitter();

    @Override
    public WriterKind kind() {
        return WriterKind.SAS_PROGRAM;
    }

    @Override
    public Set<TableName> writtenTables(String text) {
        return analyze(text).getWrites();
    }

    /**
     * Tables read from outside the program. Tables the program writes itself are internal
     * steps, not upstreams.
     */
    @Override
    public Set<TableName> readTables(String text) {
        return analyze(text).inputs();
    }

    public SasTableSummary analyze(String text) {
        return analyze(text, SasMacroEnvironment.empty());
    }

    public SasTableSummary analyze(String text, SasMacroEnvironment initial) {
        String source = SourceTextUtil.stripSasComments(text);
        Set<TableName> reads = new TreeSet<>();
        Set<TableName> writes = new TreeSet<>();

        SasMacroEnvironment env = initial;
        int cursor = 0;
        for (SasBlock block : splitter.split(source)) {
            env = env.with(env.assignmentsIn(source.substring(cursor, block.getStart())));

            Map<String, String> blockAssignments = env.assignmentsIn(block.getBody());
            SasMacroEnvironment local = env.with(blockAssignments);

            String blockText = SourceTextUtil.stripStringLiterals(local.expand(block.getBody()));
            collectStatements(blockText, local, reads, writes);
            collectMacroHints(local, reads, writes);

            env = local;
            cursor = block.getEnd();
        }
        return new SasTableSummary(reads, writes);
    }

    private void collectStatements(String blockText, SasMacroEnvironment env,
                                   Set<TableName> reads, Set<TableName> writes) {
        addAll(CREATE_TABLE, blockText, env, writes);
        addAll(INSERT_INTO, blockText, env, writes);
        addAll(UPDATE, blockText, env, writes);
        addAll(OUT_OPTION, blockText, env, writes);
        addAll(BASE_OPTION, blockText, env, writes);

        addAll(FROM, blockText, env, reads);
        addAll(JOIN, blockText, env, reads);
        addAll(DATA_OPTION, blockText, env, reads);

        Matcher data = DATA_STATEMENT.matcher(blockText);
        while (data.find()) {
            writes.addAll(identifiersInClause(data.group(1), env));
        }

        Matcher set = SET_STATEMENT.matcher(blockText);
        while (set.find()) {
            if (followsUpdate(blockText, set.start())) {
                continue;
            }
            reads.addAll(identifiersInClause(set.group(1), env));
        }
    }

    private void collectMacroHints(SasMacroEnvironment env, Set<TableName> reads, Set<TableName> writes) {
        for (Map.Entry<String, String> variable : env.variables().entrySet()) {
            String name = variable.getKey();
            TableName table = resolve(variable.getValue(), env);
            if (table == null) {
                continue;
            }
            if (name.equals("syslast") || isIoMacro(name, "_input")) {
                reads.add(table);
            }
            if (isIoMacro(name, "_output")) {
                writes.add(table);
            }
        }
    }

    /**
     * Splits a DATA/SET clause such as {@code a b(keep=x) lib.c / view=v} into table names.
     */
    List<TableName> identifiersInClause(String clause, SasMacroEnvironment env) {
        List<TableName> out = new ArrayList<>();
        String stripped = clause.strip();
        if (stripped.isEmpty() || stripped.startsWith("=")) {
            return out;
        }

        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < clause.length(); i++) {
            char ch = clause.charAt(i);
            if (ch == '(') {
                depth++;
                continue;
            }
            if (ch == ')') {
                depth = Math.max(0, depth - 1);
                continue;
            }
            if (depth > 0) {
                continue;
            }
            if (ch == ' ' || ch == ',' || ch == '\t' || ch == '\n' || ch == '\r' || ch == '/' || ch == ';') {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
                if (ch == '/' || ch == ';') {
                    break;
                }
                continue;
            }
            current.append(ch);
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }

        Set<TableName> seen = new HashSet<>();
        for (String token : tokens) {
            TableName table = resolve(token, env);
            if (table != null && seen.add(table)) {
                out.add(table);
            }
        }
        return out;
    }

    private static void addAll(Pattern pattern, String text, SasMacroEnvironment env, Set<TableName> target) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            TableName table = resolve(m.group(1), env);
            if (table != null) {
                target.add(table);
            }
        }
    }

    private static TableName resolve(String token, SasMacroEnvironment env) {
        return TableName.parse(env.expand(token)).orElse(null);
    }

    private static boolean followsUpdate(String text, int setStart) {
        int previous = text.lastIndexOf(';', setStart);
        String statement = previous >= 0 ? text.substring(previous + 1, setStart) : text.substring(0, setStart);
        return statement.toLowerCase(Locale.ROOT).contains("update");
    }

    private static boolean isIoMacro(String name, String prefix) {
        if (!name.startsWith(prefix)) {
            return false;
        }
        String tail = name.substring(prefix.length());
        return tail.isEmpty() || tail.chars().allMatch(Character::isDigit);
    }
}
