package com.pipeline.lineage.tracer.extract;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.pipeline.lineage.tracer.model.TableName;
import com.pipeline.lineage.tracer.model.WriterKind;

/**
 * SQL view DDL: {@code CREATE [OR REPLACE] VIEW db.view} writes, {@code FROM/JOIN db.tbl} reads.
 * Unqualified view names are not reported.
 */
public class ViewDefinitionExtractor implements TableExtractor {

    private static final Pattern CREATE_VIEW = Pattern.compile(
            "\\bcreate\\s+(?:or\\s+replace\\s+)?view\\s+([a-z0-9_]+(?:\\.[a-z0-9_]+)?)\\b");
    private static final Pattern FROM_JOIN = Pattern.compile(
            "\\b(?:from|join)\\s+([a-z0-9_]+)\\.([a-z0-9_]+)\\b");

    @Override
    public WriterKind kind() {
        return WriterKind.VIEW_DEFINITION;
    }

    @Override
    public Set<TableName> writtenTables(String text) {
        Set<TableName> out = new TreeSet<>();
        Matcher m = CREATE_VIEW.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            TableName.parse(m.group(1))
                    .filter(TableName::isQualified)
                    .ifPresent(out::add);
        }
        return out;
    }

    @Override
    public Set<TableName> readTables(String text) {
        Set<TableName> out = new TreeSet<>();
        Matcher m = FROM_JOIN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            out.add(TableName.of(m.group(1), m.group(2)));
        }
        return out;
    }
}
