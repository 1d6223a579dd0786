package org.javai.retrrry.report;

import org.javai.retrrry.Outcome;

/**
 * Reports retry events for observability.
 * Implementations might emit metrics or structured logs; they never influence the retry loop.
 */
public interface RetryReporter {

    /**
     * Reports a rejected attempt that is about to be retried.
     *
     * @param operation The name of the retrying operation
     * @param outcome The rejected outcome
     * @param elapsedMillis Milliseconds since the first attempt
     * @param waitMillis The wait before the next attempt
     */
    void reportRetryAttempt(String operation, Outcome<?> outcome, long elapsedMillis, long waitMillis);

    /**
     * Reports that the stop policy gave up.
     *
     * @param operation The name of the retrying operation
     * @param outcome The last outcome
     * @param elapsedMillis Milliseconds since the first attempt
     */
    default void reportGiveUp(String operation, Outcome<?> outcome, long elapsedMillis) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. This is the default: the retry loop logs nothing on its own.
     */
    static RetryReporter noOp() {
        return (operation, outcome, elapsedMillis, waitMillis) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static RetryReporter composite(RetryReporter... reporters) {
        return CompositeRetryReporter.of(reporters);
    }
}
