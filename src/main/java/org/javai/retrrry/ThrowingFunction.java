package org.javai.retrrry;

/**
 * A one-argument unit of work that may throw a checked exception.
 *
 * @param <A> The argument type
 * @param <T> The result type
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingFunction<A, T, E extends Exception> {

    T apply(A argument) throws E;
}
