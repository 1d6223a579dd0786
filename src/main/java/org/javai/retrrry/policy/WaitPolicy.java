package org.javai.retrrry.policy;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Computes how long to wait before the next attempt.
 * All durations are in milliseconds.
 */
@FunctionalInterface
public interface WaitPolicy {

    /**
     * Upper bound used when no cap is configured for incrementing or exponential waits.
     */
    long MAX_WAIT = 1073741823L;

    /**
     * Computes the delay before the next attempt.
     *
     * @param attemptNumber The attempt just made (1-based)
     * @param elapsedMillis Milliseconds since the first attempt started
     * @return a non-negative delay in milliseconds
     */
    long computeWaitMillis(int attemptNumber, long elapsedMillis);

    static WaitPolicy none() {
        return (attemptNumber, elapsedMillis) -> 0L;
    }

    static WaitPolicy fixed(long delayMillis) {
        return (attemptNumber, elapsedMillis) -> delayMillis;
    }

    /**
     * Samples uniformly from {@code [minMillis, maxMillis]} on every call.
     *
     * @throws IllegalArgumentException if min is greater than max
     */
    static WaitPolicy random(long minMillis, long maxMillis) {
        if (minMillis > maxMillis) {
            throw new IllegalArgumentException(
                    "random wait min must be <= max, was: " + minMillis + " > " + maxMillis);
        }
        return (attemptNumber, elapsedMillis) -> ThreadLocalRandom.current().nextLong(minMillis, maxMillis + 1);
    }

    /**
     * {@code start + increment * (attemptNumber - 1)}, clamped to {@code [0, maxMillis]}.
     */
    static WaitPolicy incrementing(long startMillis, long incrementMillis, long maxMillis) {
        return (attemptNumber, elapsedMillis) ->
                clamp(startMillis + incrementMillis * (attemptNumber - 1), maxMillis);
    }

    /**
     * {@code multiplier * 2^attemptNumber}, clamped to {@code [0, maxMillis]}.
     * The exponent is the raw attempt number, so the first attempt already waits {@code 2 * multiplier}.
     */
    static WaitPolicy exponential(long multiplier, long maxMillis) {
        return (attemptNumber, elapsedMillis) -> {
            // 2^62 is the largest power of two a long holds
            if (attemptNumber >= 62) {
                return multiplier > 0 ? clamp(Long.MAX_VALUE, maxMillis) : 0L;
            }
            long power = 1L << attemptNumber;
            long raw;
            try {
                raw = Math.multiplyExact(multiplier, power);
            } catch (ArithmeticException overflow) {
                raw = multiplier > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
            }
            return clamp(raw, maxMillis);
        };
    }

    /**
     * The largest delay among the given policies, never below zero.
     */
    static WaitPolicy maxOf(List<WaitPolicy> policies) {
        List<WaitPolicy> snapshot = List.copyOf(Objects.requireNonNull(policies, "policies must not be null"));
        return (attemptNumber, elapsedMillis) -> {
            long longest = 0L;
            for (WaitPolicy policy : snapshot) {
                longest = Math.max(longest, policy.computeWaitMillis(attemptNumber, elapsedMillis));
            }
            return longest;
        };
    }

    /**
     * Adds uniform jitter in {@code [0, jitterMaxMillis)} to whatever the base policy yields.
     *
     * @throws IllegalArgumentException if jitterMaxMillis is negative
     */
    static WaitPolicy jittered(WaitPolicy base, long jitterMaxMillis) {
        Objects.requireNonNull(base, "base must not be null");
        if (jitterMaxMillis < 0) {
            throw new IllegalArgumentException("jitterMaxMillis must be >= 0, was: " + jitterMaxMillis);
        }
        if (jitterMaxMillis == 0) {
            return base;
        }
        return (attemptNumber, elapsedMillis) -> {
            long jitter = (long) (ThreadLocalRandom.current().nextDouble() * jitterMaxMillis);
            return Math.max(0L, base.computeWaitMillis(attemptNumber, elapsedMillis) + Math.max(0L, jitter));
        };
    }

    private static long clamp(long value, long maxMillis) {
        long capped = Math.min(value, maxMillis);
        return Math.max(capped, 0L);
    }
}
