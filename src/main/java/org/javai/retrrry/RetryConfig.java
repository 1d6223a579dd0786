package org.javai.retrrry;

import org.javai.retrrry.policy.StopPolicy;
import org.javai.retrrry.policy.StopStrategy;
import org.javai.retrrry.policy.WaitPolicy;
import org.javai.retrrry.policy.WaitStrategy;

import java.util.function.IntConsumer;
import java.util.function.Predicate;

/**
 * The options a {@link Retrier} was built with, exactly as configured.
 *
 * <p>Numeric options that were never set are null. Whether an option was set decides which
 * sub-policies take part in the composed stop and wait policies, so the {@code effective*}
 * accessors are used wherever a default must stand in.
 *
 * @param stopMaxAttemptNumber attempts after which to stop
 * @param stopMaxDelay milliseconds since the first attempt after which to stop
 * @param waitFixed fixed wait in milliseconds
 * @param waitRandomMin lower bound of the random wait
 * @param waitRandomMax upper bound of the random wait
 * @param waitIncrementingStart first incrementing wait
 * @param waitIncrementingIncrement growth of the incrementing wait per attempt
 * @param waitIncrementingMax cap of the incrementing wait
 * @param waitExponentialMultiplier multiplier of the exponential wait
 * @param waitExponentialMax cap of the exponential wait
 * @param waitJitterMax upper bound (exclusive) of the jitter added to every wait
 * @param retryOnException failure predicate, true to retry
 * @param retryOnResult value predicate, true to retry
 * @param wrapException raise {@link RetryException} instead of the original failure
 * @param stopFunc custom stop policy replacing composition
 * @param waitFunc custom wait policy replacing composition
 * @param stopStrategy named stop strategy replacing composition
 * @param waitStrategy named wait strategy replacing composition
 * @param beforeAttempts hook called with the attempt number before each attempt
 * @param afterAttempts hook called with the attempt number after each rejected attempt
 */
public record RetryConfig(
        Integer stopMaxAttemptNumber,
        Long stopMaxDelay,
        Long waitFixed,
        Long waitRandomMin,
        Long waitRandomMax,
        Long waitIncrementingStart,
        Long waitIncrementingIncrement,
        Long waitIncrementingMax,
        Long waitExponentialMultiplier,
        Long waitExponentialMax,
        Long waitJitterMax,
        Predicate<Throwable> retryOnException,
        Predicate<Object> retryOnResult,
        boolean wrapException,
        StopPolicy stopFunc,
        WaitPolicy waitFunc,
        StopStrategy stopStrategy,
        WaitStrategy waitStrategy,
        IntConsumer beforeAttempts,
        IntConsumer afterAttempts
) {

    public static final int DEFAULT_STOP_MAX_ATTEMPT_NUMBER = 5;
    public static final long DEFAULT_STOP_MAX_DELAY = 100L;
    public static final long DEFAULT_WAIT_FIXED = 1000L;
    public static final long DEFAULT_WAIT_RANDOM_MIN = 0L;
    public static final long DEFAULT_WAIT_RANDOM_MAX = 1000L;
    public static final long DEFAULT_WAIT_INCREMENTING_START = 0L;
    public static final long DEFAULT_WAIT_INCREMENTING_INCREMENT = 100L;
    public static final long DEFAULT_WAIT_EXPONENTIAL_MULTIPLIER = 1L;
    public static final long DEFAULT_WAIT_JITTER_MAX = 0L;

    public int effectiveStopMaxAttemptNumber() {
        return stopMaxAttemptNumber == null ? DEFAULT_STOP_MAX_ATTEMPT_NUMBER : stopMaxAttemptNumber;
    }

    public long effectiveStopMaxDelay() {
        return stopMaxDelay == null ? DEFAULT_STOP_MAX_DELAY : stopMaxDelay;
    }

    public long effectiveWaitFixed() {
        return waitFixed == null ? DEFAULT_WAIT_FIXED : waitFixed;
    }

    public long effectiveWaitRandomMin() {
        return waitRandomMin == null ? DEFAULT_WAIT_RANDOM_MIN : waitRandomMin;
    }

    public long effectiveWaitRandomMax() {
        return waitRandomMax == null ? DEFAULT_WAIT_RANDOM_MAX : waitRandomMax;
    }

    public long effectiveWaitIncrementingStart() {
        return waitIncrementingStart == null ? DEFAULT_WAIT_INCREMENTING_START : waitIncrementingStart;
    }

    public long effectiveWaitIncrementingIncrement() {
        return waitIncrementingIncrement == null ? DEFAULT_WAIT_INCREMENTING_INCREMENT : waitIncrementingIncrement;
    }

    public long effectiveWaitIncrementingMax() {
        return waitIncrementingMax == null ? WaitPolicy.MAX_WAIT : waitIncrementingMax;
    }

    public long effectiveWaitExponentialMultiplier() {
        return waitExponentialMultiplier == null ? DEFAULT_WAIT_EXPONENTIAL_MULTIPLIER : waitExponentialMultiplier;
    }

    public long effectiveWaitExponentialMax() {
        return waitExponentialMax == null ? WaitPolicy.MAX_WAIT : waitExponentialMax;
    }

    public long effectiveWaitJitterMax() {
        return waitJitterMax == null ? DEFAULT_WAIT_JITTER_MAX : waitJitterMax;
    }
}
