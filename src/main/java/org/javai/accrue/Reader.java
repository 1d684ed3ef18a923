package org.javai.accrue;

import java.util.Objects;
import java.util.function.Function;

/**
 * A computation that depends on an environment {@code R} and produces an {@code A}.
 *
 * <p>In this library the environment is almost always the validation {@link Context}:
 * a {@code Reader<Context, Validation<A>>} is a validation result that has not yet been
 * told where in the input structure it is operating.
 *
 * @param <R> The environment type
 * @param <A> The produced type
 */
@FunctionalInterface
public interface Reader<R, A> {

    A apply(R environment);

    default <B> Reader<R, B> map(Function<? super A, ? extends B> mapper) {
        Objects.requireNonNull(mapper);
        return r -> mapper.apply(apply(r));
    }

    default <B> Reader<R, B> chain(Function<? super A, ? extends Reader<R, B>> mapper) {
        Objects.requireNonNull(mapper);
        return r -> mapper.apply(apply(r)).apply(r);
    }

    /**
     * Runs this reader in an environment derived from the outer one.
     */
    default Reader<R, A> local(Function<? super R, ? extends R> modify) {
        Objects.requireNonNull(modify);
        return r -> apply(modify.apply(r));
    }

    static <R, A> Reader<R, A> of(A value) {
        return r -> value;
    }

    static <R> Reader<R, R> ask() {
        return r -> r;
    }
}
