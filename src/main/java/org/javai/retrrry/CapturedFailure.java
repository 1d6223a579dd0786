package org.javai.retrrry;

import java.lang.reflect.UndeclaredThrowableException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A failure captured from one attempt of a unit of work.
 *
 * <p>The original throwable is kept so it can be rethrown as-is. Type, message and trace
 * are snapshotted at capture time so the failure can be inspected without touching the
 * throwable again.
 *
 * @param exception The throwable raised by the unit of work
 * @param type The throwable's class name
 * @param message The throwable's message (may be null)
 * @param fingerprint A stable identifier for deduplication (type plus top stack frame)
 * @param trace The stack trace as it was when captured
 * @param occurredAt When the failure was captured
 */
public record CapturedFailure(
        Throwable exception,
        String type,
        String message,
        String fingerprint,
        List<StackTraceElement> trace,
        Instant occurredAt
) {

    public CapturedFailure {
        Objects.requireNonNull(exception, "exception must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        trace = trace == null ? List.of() : List.copyOf(trace);
    }

    public static CapturedFailure capture(Throwable t) {
        Objects.requireNonNull(t, "throwable must not be null");
        StackTraceElement[] stack = t.getStackTrace();
        return new CapturedFailure(
                t,
                t.getClass().getName(),
                t.getMessage(),
                computeFingerprint(t, stack),
                List.of(stack),
                Instant.now());
    }

    /**
     * Returns true if the captured throwable is an instance of the given type.
     */
    public boolean isInstanceOf(Class<?> kind) {
        return kind.isInstance(exception);
    }

    /**
     * Rethrows the original throwable without wrapping it.
     * A throwable that is neither an {@link Exception} nor an {@link Error} is wrapped in an
     * {@link UndeclaredThrowableException}.
     */
    public void rethrow() throws Exception {
        if (exception instanceof Error error) {
            throw error;
        }
        if (exception instanceof Exception e) {
            throw e;
        }
        throw new UndeclaredThrowableException(exception);
    }

    public String formattedTrace() {
        StringBuilder sb = new StringBuilder();
        sb.append(type);
        if (message != null) {
            sb.append(": ").append(message);
        }
        for (StackTraceElement frame : trace) {
            sb.append("\n\tat ").append(frame);
        }
        return sb.toString();
    }

    private static String computeFingerprint(Throwable t, StackTraceElement[] stack) {
        if (stack.length == 0) {
            return t.getClass().getName();
        }
        StackTraceElement top = stack[0];
        return t.getClass().getSimpleName() + "@" + top.getClassName() + ":" + top.getLineNumber();
    }
}
