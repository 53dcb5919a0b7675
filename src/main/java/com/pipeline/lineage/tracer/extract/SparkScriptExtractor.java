package com.pipeline.lineage.tracer.extract;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.WriterKind;

/**
 * PySpark jobs.
 *
 * Writes come from every "Output table(s)" section of the header comment block and from
 * {@code .insertInto('db.tbl', ...)} calls. Reads come from {@code spark.table('db.tbl')}.
 * Only qualified names are reported.
 */
public class SparkScriptExtractor implements TableExtractor {
    private static final Logger log = LoggerFactory.getLogger(SparkScriptExtractor.class);

    private static final Pattern SPARK_TABLE = Pattern.compile(
            "spark\\.table\\(\\s*['\"]([a-z0-9_]+)\\.([a-z0-9_]+)['\"]\\s*\\)");
    private static final Pattern INSERT_INTO = Pattern.compile(
            "\\.insertinto\\(\\s*['\"]([a-z0-9_]+)\\.([a-z0-9_]+)['\"]\\s*,");

    // db.tbl followed by space, comma, semicolon, bracket, '#', '-' or end of line
    private static final Pattern INLINE_FQTN = Pattern.compile(
            "\\b([a-z0-9_]+)\\.([a-z0-9_]+)(?=[\\s,;)\\]#\\-]|$)");

    private static final Pattern COMMENT_OR_BLANK = Pattern.compile("^\\s*(#|//|/\\*|\\*|--).*|^\\s*$");
    private static final Pattern DECORATION_PREFIX = Pattern.compile("^[\\s#/*\\-|>]+");
    private static final Pattern OUTPUT_HEADER = Pattern.compile("^output\\s+tables?\\b.*");
    private static final Pattern BANNER = Pattern.compile("^\\s*#{5,}\\s*$");
    private static final Pattern OTHER_HEADER = Pattern.compile(
            "^(input|job|jobs|user|used|usage|purpose|revision|revisions|history|company|author|date"
                    + "|data|datastage|sas|view)\\b.*");
    private static final Pattern LABEL_ONLY = Pattern.compile(
            "^[a-z][a-z0-9 _/\\-()]*\\s*[:\\uFF1A\\-\\u2013\\u2014]\\s*$");

    @Override
    public WriterKind kind() {
        return WriterKind.SPARK_SCRIPT;
    }

    @Override
    public Set<TableName> writtenTables(String text) {
        Set<TableName> out = new TreeSet<>(parseOutputSections(text));
        out.addAll(findQualified(INSERT_INTO, text.toLowerCase(Locale.ROOT)));
        return out;
    }

    @Override
    public Set<TableName> readTables(String text) {
        return findQualified(SPARK_TABLE, text.toLowerCase(Locale.ROOT));
    }

    /**
     * Collects db.tbl tokens from each "Output table(s)" section. A section is the run of
     * comment lines right after the header; it ends at the first line of code or at another
     * header-like label such as "Input tables:".
     */
    Set<TableName> parseOutputSections(String text) {
        Set<TableName> out = new TreeSet<>();
        List<String> rawLines = text.lines().toList();

        int i = 0;
        int sections = 0;
        while (i < rawLines.size()) {
            if (!isOutputHeader(normalizeLine(rawLines.get(i)))) {
                i++;
                continue;
            }
            sections++;
            i++;
            while (i < rawLines.size()) {
                String raw = rawLines.get(i);
                String norm = normalizeLine(raw);
                if (!COMMENT_OR_BLANK.matcher(raw).matches()) {
                    break;
                }
                if (isSectionBreak(norm) && !isOutputHeader(norm)) {
                    break;
                }
                Matcher m = INLINE_FQTN.matcher(norm);
                while (m.find()) {
                    out.add(TableName.of(m.group(1), m.group(2)));
                }
                i++;
            }
        }
        if (sections > 0) {
            log.debug("Output sections: {}, tables: {}", sections, out);
        }
        return out;
    }

    private static String normalizeLine(String raw) {
        String s = SourceTextUtil.normalizeInvisibles(raw).toLowerCase(Locale.ROOT).stripTrailing();
        return DECORATION_PREFIX.matcher(s).replaceFirst("");
    }

    private static boolean isOutputHeader(String norm) {
        return OUTPUT_HEADER.matcher(norm).matches();
    }

    private static boolean isSectionBreak(String norm) {
        return BANNER.matcher(norm).matches()
                || OTHER_HEADER.matcher(norm).matches()
                || LABEL_ONLY.matcher(norm).matches();
    }

    private static Set<TableName> findQualified(Pattern pattern, String lowerText) {
        Set<TableName> out = new TreeSet<>();
        Matcher m = pattern.matcher(lowerText);
        while (m.find()) {
            out.add(TableName.of(m.group(1), m.group(2)));
        }
        return out;
    }
}
