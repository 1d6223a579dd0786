package org.javai.retrrry;

import java.util.Objects;

/**
 * Wraps units of work so that every invocation runs through a {@link Retrier}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * // All defaults
 * ThrowingSupplier<String, IOException> read = Retrying.wrap(() -> Files.readString(path));
 *
 * // Configured
 * Retrier retrier = Retrier.builder().stopMaxAttemptNumber(3).waitFixed(200).build();
 * ThrowingFunction<Long, User, IOException> fetch = Retrying.wrapFunction(retrier, client::fetchUser);
 * User user = fetch.apply(42L);
 * }</pre>
 */
public final class Retrying {

    private Retrying() {
    }

    /**
     * Wraps the work with a default {@link Retrier}.
     */
    public static <T, E extends Exception> ThrowingSupplier<T, E> wrap(ThrowingSupplier<T, E> work) {
        return wrap(Retrier.defaults(), work);
    }

    /**
     * Wraps the work with the given {@link Retrier}. Each call of the returned supplier runs a fresh retry loop.
     */
    public static <T, E extends Exception> ThrowingSupplier<T, E> wrap(Retrier retrier, ThrowingSupplier<T, E> work) {
        Objects.requireNonNull(retrier, "retrier must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return () -> retrier.call(work);
    }

    /**
     * Wraps a one-argument function with a default {@link Retrier}.
     */
    public static <A, T, E extends Exception> ThrowingFunction<A, T, E> wrapFunction(ThrowingFunction<A, T, E> work) {
        return wrapFunction(Retrier.defaults(), work);
    }

    /**
     * Wraps a one-argument function with the given {@link Retrier}. Every attempt of one call receives the same argument.
     */
    public static <A, T, E extends Exception> ThrowingFunction<A, T, E> wrapFunction(
            Retrier retrier,
            ThrowingFunction<A, T, E> work
    ) {
        Objects.requireNonNull(retrier, "retrier must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return argument -> retrier.call(work, argument);
    }
}
