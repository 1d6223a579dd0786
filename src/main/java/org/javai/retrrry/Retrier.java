package org.javai.retrrry;

import org.javai.retrrry.policy.RejectionPolicy;
import org.javai.retrrry.policy.StopPolicy;
import org.javai.retrrry.policy.StopStrategy;
import org.javai.retrrry.policy.WaitPolicy;
import org.javai.retrrry.policy.WaitStrategy;
import org.javai.retrrry.report.CompositeRetryReporter;
import org.javai.retrrry.report.RetryReporter;

import java.lang.reflect.UndeclaredThrowableException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;
import java.util.function.Predicate;

/**
 * Invokes a unit of work until an attempt is accepted or the stop policy gives up.
 *
 * <p>Each attempt is captured as an {@link Outcome}. The rejection policy decides whether the
 * outcome needs another attempt, the stop policy whether another attempt is allowed, and the
 * wait policy how long to block before it. A call ends exactly once, with one of:
 * <ul>
 *   <li>the produced value of an accepted attempt;</li>
 *   <li>the original failure, when a failure is accepted, or when the loop gives up on a
 *       failure without wrapping;</li>
 *   <li>a {@link RetryException} carrying the last outcome otherwise.</li>
 * </ul>
 *
 * <p>Policies are resolved once, when the Retrier is built. A Retrier holds no per-call state and
 * may be shared between threads.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .stopMaxAttemptNumber(3)
 *     .waitExponentialMultiplier(100)
 *     .waitExponentialMax(5_000)
 *     .retryOnExceptionOfType(List.of(IOException.class))
 *     .build();
 *
 * Response response = retrier.call(() -> client.fetch(userId));
 * }</pre>
 */
public final class Retrier {

    private static final String DEFAULT_NAME = "retry";

    private final RetryConfig config;
    private final String name;
    private final StopPolicy stopPolicy;
    private final WaitPolicy waitPolicy;
    private final RejectionPolicy rejectionPolicy;
    private final RetryReporter reporter;
    private final Sleeper sleeper;
    private final Clock clock;

    private Retrier(RetryConfig config, String name, RetryReporter reporter, Sleeper sleeper, Clock clock) {
        this.config = config;
        this.name = name;
        // a failing reporter is logged and skipped
        this.reporter = reporter instanceof CompositeRetryReporter ? reporter : CompositeRetryReporter.of(reporter);
        this.sleeper = sleeper;
        this.clock = clock;
        this.stopPolicy = resolveStopPolicy(config);
        this.waitPolicy = resolveWaitPolicy(config);
        this.rejectionPolicy = RejectionPolicy.of(config.retryOnException(), config.retryOnResult());
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A Retrier with every option at its default: every failure is retried, no produced value is,
     * there is no stop bound and no wait between attempts.
     */
    public static Retrier defaults() {
        return builder().build();
    }

    public RetryConfig config() {
        return config;
    }

    public String name() {
        return name;
    }

    public StopPolicy stopPolicy() {
        return stopPolicy;
    }

    public WaitPolicy waitPolicy() {
        return waitPolicy;
    }

    public RejectionPolicy rejectionPolicy() {
        return rejectionPolicy;
    }

    /**
     * Runs the retry loop around the given unit of work.
     *
     * @param work the unit of work, invoked once per attempt
     * @return the value produced by the accepted attempt
     * @throws E the original failure, when it is accepted or when giving up without wrapping
     * @throws RetryException when giving up on a produced value, or on a failure with wrapping enabled
     */
    public <T, E extends Exception> T call(ThrowingSupplier<T, E> work) throws E {
        Objects.requireNonNull(work, "work must not be null");

        long startedAt = clock.millis();
        int attemptNumber = 1;
        while (true) {
            if (config.beforeAttempts() != null) {
                config.beforeAttempts().accept(attemptNumber);
            }

            Outcome<T> outcome = attempt(work, attemptNumber);

            if (!rejectionPolicy.shouldReject(outcome)) {
                return this.<T, E>accept(outcome);
            }

            if (config.afterAttempts() != null) {
                config.afterAttempts().accept(attemptNumber);
            }

            long elapsedMillis = clock.millis() - startedAt;
            if (stopPolicy.shouldStop(attemptNumber, elapsedMillis)) {
                reporter.reportGiveUp(name, outcome, elapsedMillis);
                throw this.<E>giveUp(outcome);
            }

            long waitMillis = waitPolicy.computeWaitMillis(attemptNumber, elapsedMillis);
            reporter.reportRetryAttempt(name, outcome, elapsedMillis, waitMillis);
            sleep(waitMillis);
            attemptNumber++;
        }
    }

    /**
     * Runs the retry loop around a one-argument unit of work, passing the same argument on every attempt.
     */
    public <A, T, E extends Exception> T call(ThrowingFunction<A, T, E> work, A argument) throws E {
        Objects.requireNonNull(work, "work must not be null");
        return call(() -> work.apply(argument));
    }

    private static <T, E extends Exception> Outcome<T> attempt(ThrowingSupplier<T, E> work, int attemptNumber) {
        try {
            return Outcome.ok(attemptNumber, work.get());
        } catch (Throwable t) {
            // errors included
            return Outcome.fail(attemptNumber, t);
        }
    }

    private <T, E extends Exception> T accept(Outcome<T> outcome) throws E {
        if (outcome instanceof Outcome.Fail<T> fail) {
            if (config.wrapException()) {
                throw new RetryException(fail);
            }
            throw Retrier.<E>rethrow(fail.failure());
        }
        return ((Outcome.Ok<T>) outcome).value();
    }

    private <E extends Exception> RuntimeException giveUp(Outcome<?> outcome) throws E {
        if (!config.wrapException() && outcome instanceof Outcome.Fail<?> fail) {
            throw Retrier.<E>rethrow(fail.failure());
        }
        return new RetryException(outcome);
    }

    /**
     * Rethrows the captured throwable as-is. Checked exceptions can only have come from a unit of
     * work declared to throw {@code E}.
     */
    private static <E extends Exception> RuntimeException rethrow(CapturedFailure failure) throws E {
        Throwable t = failure.exception();
        if (t instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (t instanceof Error error) {
            throw error;
        }
        if (t instanceof Exception) {
            throw (E) t;
        }
        throw new UndeclaredThrowableException(t);
    }

    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static StopPolicy resolveStopPolicy(RetryConfig config) {
        if (config.stopFunc() != null) {
            return config.stopFunc();
        }
        if (config.stopStrategy() != null) {
            return config.stopStrategy().create(config);
        }
        List<StopPolicy> policies = new ArrayList<>();
        if (config.stopMaxAttemptNumber() != null) {
            policies.add(StopPolicy.afterAttempt(config.stopMaxAttemptNumber()));
        }
        if (config.stopMaxDelay() != null) {
            policies.add(StopPolicy.afterDelay(config.stopMaxDelay()));
        }
        return StopPolicy.anyOf(policies);
    }

    static WaitPolicy resolveWaitPolicy(RetryConfig config) {
        WaitPolicy selected;
        if (config.waitFunc() != null) {
            selected = config.waitFunc();
        } else if (config.waitStrategy() != null) {
            selected = config.waitStrategy().create(config);
        } else {
            List<WaitPolicy> policies = new ArrayList<>();
            policies.add(WaitPolicy.none());
            if (config.waitFixed() != null) {
                policies.add(WaitPolicy.fixed(config.waitFixed()));
            }
            if (config.waitRandomMin() != null || config.waitRandomMax() != null) {
                policies.add(WaitPolicy.random(config.effectiveWaitRandomMin(), config.effectiveWaitRandomMax()));
            }
            if (config.waitIncrementingStart() != null || config.waitIncrementingIncrement() != null) {
                policies.add(WaitPolicy.incrementing(
                        config.effectiveWaitIncrementingStart(),
                        config.effectiveWaitIncrementingIncrement(),
                        config.effectiveWaitIncrementingMax()));
            }
            if (config.waitExponentialMultiplier() != null || config.waitExponentialMax() != null) {
                policies.add(WaitPolicy.exponential(
                        config.effectiveWaitExponentialMultiplier(),
                        config.effectiveWaitExponentialMax()));
            }
            selected = WaitPolicy.maxOf(policies);
        }
        return WaitPolicy.jittered(selected, config.effectiveWaitJitterMax());
    }

    /**
     * Builder for configuring a Retrier instance. Every option is optional.
     *
     * <p>Example usage:</p>
     * <pre>{@code
     * Retrier retrier = Retrier.builder()
     *     .stopMaxDelay(30_000)
     *     .waitRandomMin(100)
     *     .waitRandomMax(500)
     *     .retryOnResult(result -> result == null)
     *     .reporter(new Log4jRetryReporter())
     *     .build();
     * }</pre>
     */
    public static final class Builder {
        private Integer stopMaxAttemptNumber;
        private Long stopMaxDelay;
        private Long waitFixed;
        private Long waitRandomMin;
        private Long waitRandomMax;
        private Long waitIncrementingStart;
        private Long waitIncrementingIncrement;
        private Long waitIncrementingMax;
        private Long waitExponentialMultiplier;
        private Long waitExponentialMax;
        private Long waitJitterMax;
        private Predicate<Throwable> retryOnException;
        private Predicate<Object> retryOnResult;
        private boolean wrapException;
        private StopPolicy stopFunc;
        private WaitPolicy waitFunc;
        private StopStrategy stopStrategy;
        private WaitStrategy waitStrategy;
        private IntConsumer beforeAttempts;
        private IntConsumer afterAttempts;

        private String name = DEFAULT_NAME;
        private RetryReporter reporter = RetryReporter.noOp();
        private Sleeper sleeper = Thread::sleep;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder stopMaxAttemptNumber(int stopMaxAttemptNumber) {
            this.stopMaxAttemptNumber = stopMaxAttemptNumber;
            return this;
        }

        public Builder stopMaxDelay(long stopMaxDelayMillis) {
            this.stopMaxDelay = stopMaxDelayMillis;
            return this;
        }

        public Builder waitFixed(long waitFixedMillis) {
            this.waitFixed = waitFixedMillis;
            return this;
        }

        public Builder waitRandomMin(long waitRandomMinMillis) {
            this.waitRandomMin = waitRandomMinMillis;
            return this;
        }

        public Builder waitRandomMax(long waitRandomMaxMillis) {
            this.waitRandomMax = waitRandomMaxMillis;
            return this;
        }

        public Builder waitIncrementingStart(long waitIncrementingStartMillis) {
            this.waitIncrementingStart = waitIncrementingStartMillis;
            return this;
        }

        public Builder waitIncrementingIncrement(long waitIncrementingIncrementMillis) {
            this.waitIncrementingIncrement = waitIncrementingIncrementMillis;
            return this;
        }

        public Builder waitIncrementingMax(long waitIncrementingMaxMillis) {
            this.waitIncrementingMax = waitIncrementingMaxMillis;
            return this;
        }

        public Builder waitExponentialMultiplier(long waitExponentialMultiplier) {
            this.waitExponentialMultiplier = waitExponentialMultiplier;
            return this;
        }

        public Builder waitExponentialMax(long waitExponentialMaxMillis) {
            this.waitExponentialMax = waitExponentialMaxMillis;
            return this;
        }

        public Builder waitJitterMax(long waitJitterMaxMillis) {
            this.waitJitterMax = waitJitterMaxMillis;
            return this;
        }

        /**
         * Sets the failure predicate: true means the failure is retried.
         */
        public Builder retryOnException(Predicate<Throwable> retryOnException) {
            this.retryOnException = Objects.requireNonNull(retryOnException, "retryOnException must not be null");
            return this;
        }

        /**
         * Retries only failures that are instances of one of the given types.
         */
        public Builder retryOnExceptionOfType(Collection<? extends Class<? extends Throwable>> types) {
            return retryOnException(RejectionPolicy.retryIfExceptionOfType(types));
        }

        /**
         * Sets the value predicate: true means the produced value is retried.
         */
        public Builder retryOnResult(Predicate<Object> retryOnResult) {
            this.retryOnResult = Objects.requireNonNull(retryOnResult, "retryOnResult must not be null");
            return this;
        }

        public Builder wrapException(boolean wrapException) {
            this.wrapException = wrapException;
            return this;
        }

        /**
         * Replaces the composed stop policy entirely.
         */
        public Builder stopFunc(StopPolicy stopFunc) {
            this.stopFunc = Objects.requireNonNull(stopFunc, "stopFunc must not be null");
            return this;
        }

        /**
         * Replaces the composed wait policy entirely. Jitter still applies on top.
         */
        public Builder waitFunc(WaitPolicy waitFunc) {
            this.waitFunc = Objects.requireNonNull(waitFunc, "waitFunc must not be null");
            return this;
        }

        public Builder stopStrategy(StopStrategy stop) {
            this.stopStrategy = Objects.requireNonNull(stop, "stop must not be null");
            return this;
        }

        /**
         * Selects a built-in stop policy by name.
         *
         * @throws IllegalArgumentException if the name is unknown
         */
        public Builder stopStrategy(String stopName) {
            return stopStrategy(StopStrategy.fromName(stopName));
        }

        public Builder waitStrategy(WaitStrategy wait) {
            this.waitStrategy = Objects.requireNonNull(wait, "wait must not be null");
            return this;
        }

        /**
         * Selects a built-in wait policy by name.
         *
         * @throws IllegalArgumentException if the name is unknown
         */
        public Builder waitStrategy(String waitName) {
            return waitStrategy(WaitStrategy.fromName(waitName));
        }

        public Builder beforeAttempts(IntConsumer beforeAttempts) {
            this.beforeAttempts = Objects.requireNonNull(beforeAttempts, "beforeAttempts must not be null");
            return this;
        }

        public Builder afterAttempts(IntConsumer afterAttempts) {
            this.afterAttempts = Objects.requireNonNull(afterAttempts, "afterAttempts must not be null");
            return this;
        }

        /**
         * Sets the name reported with retry events (optional, defaults to "retry").
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         */
        public Builder reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Sets the clock used to measure elapsed time, for testing (package-private).
         */
        Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Builds the Retrier, resolving its policies.
         *
         * @return a configured Retrier
         * @throws IllegalArgumentException if the options cannot form valid policies
         */
        public Retrier build() {
            RetryConfig config = new RetryConfig(
                    stopMaxAttemptNumber, stopMaxDelay,
                    waitFixed, waitRandomMin, waitRandomMax,
                    waitIncrementingStart, waitIncrementingIncrement, waitIncrementingMax,
                    waitExponentialMultiplier, waitExponentialMax, waitJitterMax,
                    retryOnException, retryOnResult, wrapException,
                    stopFunc, waitFunc, stopStrategy, waitStrategy,
                    beforeAttempts, afterAttempts);
            return new Retrier(config, name, reporter, sleeper, clock);
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
