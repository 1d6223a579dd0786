package org.javai.retrrry;

import java.util.Objects;

/**
 * The outcome of a single attempt of a unit of work.
 * Either {@link Ok} holding the produced value, or {@link Fail} holding the {@link CapturedFailure}.
 *
 * <p>Every outcome is tagged with the 1-based number of the attempt that produced it.
 *
 * @param <T> The type of the produced value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * An attempt that returned normally. The value may be null.
     *
     * @param attemptNumber the attempt that produced this outcome
     * @param value the produced value
     */
    record Ok<T>(int attemptNumber, T value) implements Outcome<T> {

        public Ok {
            requireValidAttemptNumber(attemptNumber);
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public T get(boolean wrapException) {
            return value;
        }

        @Override
        public String toString() {
            return "Attempts: " + attemptNumber + ", Value: " + value;
        }
    }

    /**
     * An attempt that raised.
     *
     * @param attemptNumber the attempt that produced this outcome
     * @param failure the captured failure
     */
    record Fail<T>(int attemptNumber, CapturedFailure failure) implements Outcome<T> {

        public Fail {
            requireValidAttemptNumber(attemptNumber);
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T get(boolean wrapException) throws Exception {
            if (wrapException) {
                throw new RetryException(this);
            }
            failure.rethrow();
            throw new IllegalStateException("unreachable: rethrow returned normally");
        }

        @Override
        public String toString() {
            return "Attempts: " + attemptNumber + ", Error:\n" + failure.formattedTrace();
        }
    }

    int attemptNumber();

    boolean isOk();

    boolean isFail();

    /**
     * Returns the produced value, or raises the captured failure.
     *
     * @param wrapException if true a failure is raised as a {@link RetryException} wrapping this
     *                      outcome, otherwise the original throwable is rethrown
     * @return the produced value
     * @throws Exception the original failure when not wrapping
     */
    T get(boolean wrapException) throws Exception;

    /**
     * Returns the produced value, or throws a {@link RetryException} wrapping this outcome.
     */
    default T getOrThrow() {
        if (this instanceof Fail<T> fail) {
            throw new RetryException(fail);
        }
        return ((Ok<T>) this).value();
    }

    static <T> Outcome<T> ok(int attemptNumber, T value) {
        return new Ok<>(attemptNumber, value);
    }

    static <T> Outcome<T> fail(int attemptNumber, Throwable throwable) {
        return new Fail<>(attemptNumber, CapturedFailure.capture(throwable));
    }

    private static void requireValidAttemptNumber(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, was: " + attemptNumber);
        }
    }
}
