package org.javai.retrrry.policy;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether the retry loop must give up instead of attempting again.
 */
@FunctionalInterface
public interface StopPolicy {

    /**
     * Evaluates whether to stop after a rejected attempt.
     *
     * @param attemptNumber The attempt just made (1-based)
     * @param elapsedMillis Milliseconds since the first attempt started
     * @return true to give up
     */
    boolean shouldStop(int attemptNumber, long elapsedMillis);

    /**
     * Stops once {@code attemptNumber >= maxAttempts}.
     */
    static StopPolicy afterAttempt(int maxAttempts) {
        return (attemptNumber, elapsedMillis) -> attemptNumber >= maxAttempts;
    }

    /**
     * Stops once {@code elapsedMillis >= maxDelayMillis}.
     */
    static StopPolicy afterDelay(long maxDelayMillis) {
        return (attemptNumber, elapsedMillis) -> elapsedMillis >= maxDelayMillis;
    }

    /**
     * Never stops. The loop then ends only when an attempt is accepted.
     */
    static StopPolicy never() {
        return (attemptNumber, elapsedMillis) -> false;
    }

    /**
     * Stops when any of the given policies says so. An empty list never stops.
     */
    static StopPolicy anyOf(List<StopPolicy> policies) {
        List<StopPolicy> snapshot = List.copyOf(Objects.requireNonNull(policies, "policies must not be null"));
        return (attemptNumber, elapsedMillis) -> {
            for (StopPolicy policy : snapshot) {
                if (policy.shouldStop(attemptNumber, elapsedMillis)) {
                    return true;
                }
            }
            return false;
        };
    }
}
