package com.reactive.xray.segment;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.reactive.xray.id.IdGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of an entity's {@code cause.exceptions}.
 *
 * @param truncated number of stack frames dropped beyond {@link #MAX_STACK_FRAMES}
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ExceptionRecord(
    String id,
    String message,
    String type,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean remote,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) int truncated,
    List<StackFrame> stack
) {

    public static final int MAX_STACK_FRAMES = 50;

    public ExceptionRecord {
        stack = List.copyOf(stack);
    }

    public static ExceptionRecord of(Throwable t) {
        StackTraceElement[] trace = t.getStackTrace();
        int kept = Math.min(trace.length, MAX_STACK_FRAMES);
        List<StackFrame> frames = new ArrayList<>(kept);
        for (int i = 0; i < kept; i++) {
            frames.add(StackFrame.of(trace[i]));
        }
        return new ExceptionRecord(
            IdGenerator.getInstance().generateEntityId(),
            t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName(),
            t.getClass().getName(),
            false,
            trace.length - kept,
            frames
        );
    }

    /**
     * Stand-in record for an error or fault raised only by the response status.
     */
    public static ExceptionRecord forStatus(int status) {
        return new ExceptionRecord(
            IdGenerator.getInstance().generateEntityId(),
            "HTTP status " + status,
            "HttpStatus",
            false,
            0,
            List.of()
        );
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record StackFrame(String path, int line, String label) {
        static StackFrame of(StackTraceElement e) {
            return new StackFrame(
                e.getFileName() != null ? e.getFileName() : "",
                Math.max(e.getLineNumber(), 0),
                e.getClassName() + "." + e.getMethodName()
            );
        }
    }
}
