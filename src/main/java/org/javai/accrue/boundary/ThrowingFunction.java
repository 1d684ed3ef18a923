package org.javai.accrue.boundary;

/**
 * A function that may throw a checked exception.
 * Used by {@link Boundary} to wrap third-party parsers and decoders.
 *
 * @param <I> The input type
 * @param <A> The result type
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingFunction<I, A, E extends Exception> {

    A apply(I input) throws E;
}
