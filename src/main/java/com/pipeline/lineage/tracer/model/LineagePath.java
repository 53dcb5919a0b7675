package com.pipeline.lineage.tracer.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;

/**
 * Ordered chain {@code [target, layer1, ..., source]}; never empty.
 */
@EqualsAndHashCode
public final class LineagePath {

    private final List<TableName> tables;

    private LineagePath(List<TableName> tables) {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("A lineage path holds at least one table");
        }
        this.tables = List.copyOf(tables);
    }

    public static LineagePath of(TableName... tables) {
        return new LineagePath(List.of(tables));
    }

    public static LineagePath of(List<TableName> tables) {
        return new LineagePath(tables);
    }

    /**
     * New path with {@code head} in front of this one.
     */
    public LineagePath prepend(TableName head) {
        List<TableName> extended = new ArrayList<>(tables.size() + 1);
        extended.add(head);
        extended.addAll(tables);
        return new LineagePath(extended);
    }

    public List<TableName> getTables() {
        return tables;
    }

    public int length() {
        return tables.size();
    }

    public TableName head() {
        return tables.get(0);
    }

    public TableName source() {
        return tables.get(tables.size() - 1);
    }

    /**
     * Tables strictly between the head and the source.
     */
    public List<TableName> layers() {
        if (tables.size() <= 2) {
            return List.of();
        }
        return tables.subList(1, tables.size() - 1);
    }

    @Override
    public String toString() {
        return tables.stream().map(TableName::toString).collect(Collectors.joining(" <- "));
    }
}
