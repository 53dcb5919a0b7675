package com.pipeline.lineage.tracer.model;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import lombok.Getter;

/**
 * Errors, warnings and infos accumulated during a tracing run.
 *
 * Pure structure only: no logging, no formatting, no IO. Safe to append from several
 * resolver threads.
 */
@Getter
public class TraceDiagnostics {
    private final List<String> errors = new CopyOnWriteArrayList<>();
    private final List<String> warnings = new CopyOnWriteArrayList<>();
    private final List<String> infos = new CopyOnWriteArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
