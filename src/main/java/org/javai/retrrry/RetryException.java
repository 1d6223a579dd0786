package org.javai.retrrry;

import java.util.Objects;

/**
 * Thrown by {@link Retrier} when it gives up, carrying the last {@link Outcome} it produced.
 *
 * <p>Raised when the last outcome was an unsatisfactory value (there is no failure to rethrow),
 * or when wrapping is enabled. For a wrapped failure the original throwable is the cause.
 */
public class RetryException extends RuntimeException {

    private final Outcome<?> lastAttempt;

    public RetryException(Outcome<?> lastAttempt) {
        super("RetryError[" + Objects.requireNonNull(lastAttempt, "lastAttempt must not be null") + "]",
                lastAttempt instanceof Outcome.Fail<?> fail ? fail.failure().exception() : null);
        this.lastAttempt = lastAttempt;
    }

    public Outcome<?> lastAttempt() {
        return lastAttempt;
    }

    public int attemptNumber() {
        return lastAttempt.attemptNumber();
    }
}
