package org.javai.accrue;

import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.Supplier;

/**
 * An associative binary operation with an identity element.
 *
 * <p>Implementations must satisfy {@code concat(empty(), a) == a},
 * {@code concat(a, empty()) == a} and
 * {@code concat(concat(a, b), c) == concat(a, concat(b, c))}.
 *
 * @param <A> The carrier type
 */
public interface Monoid<A> {

    A empty();

    A concat(A first, A second);

    /**
     * Combines all elements left to right, starting from {@link #empty()}.
     */
    default A fold(Iterable<? extends A> elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        A acc = empty();
        for (A element : elements) {
            acc = concat(acc, element);
        }
        return acc;
    }

    static <A> Monoid<A> of(A empty, BinaryOperator<A> concat) {
        return lazy(() -> empty, concat);
    }

    /**
     * Creates a monoid whose identity is computed on every call to {@link #empty()}.
     */
    static <A> Monoid<A> lazy(Supplier<? extends A> empty, BinaryOperator<A> concat) {
        Objects.requireNonNull(empty, "empty must not be null");
        Objects.requireNonNull(concat, "concat must not be null");
        return new Monoid<>() {
            @Override
            public A empty() {
                return empty.get();
            }

            @Override
            public A concat(A first, A second) {
                return concat.apply(first, second);
            }
        };
    }
}
