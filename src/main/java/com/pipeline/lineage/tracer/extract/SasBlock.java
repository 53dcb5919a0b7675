package com.pipeline.lineage.tracer.extract;

import lombok.Value;

/**
 * One {@code PROC SQL ... QUIT;} or {@code DATA ... RUN;} block of a SAS program.
 */
@Value
public class SasBlock {

    public enum Type { SQL, DATA }

    Type type;

    /** Offset of the block header. */
    int start;

    /** Offset just past the terminating statement (exclusive). */
    int end;

    /** Text after the header statement up to and including the terminator. */
    String body;
}
