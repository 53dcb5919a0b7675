package com.pipeline.lineage.tracer.output;

/**
 * A lineage CSV that lacks the columns or structure the tool needs.
 */
public class LineageFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LineageFormatException(String message) {
        super(message);
    }
}
