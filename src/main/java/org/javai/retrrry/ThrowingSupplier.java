package org.javai.retrrry;

/**
 * A unit of work that may throw a checked exception.
 * This is the shape {@link Retrier} invokes on every attempt.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
