package org.javai.accrue.validate;

import java.util.function.Function;

/**
 * A transformation from one validator to another, as returned by the curried factories in
 * {@link Validators}.
 *
 * @param <I> The input type shared by both validators
 * @param <A> The type validated before the transformation
 * @param <B> The type validated after it
 */
@FunctionalInterface
public interface ValidateOperator<I, A, B> extends Function<Validate<I, A>, Validate<I, B>> {

    /**
     * Applies this operator, then {@code next}.
     */
    default <C> ValidateOperator<I, A, C> then(ValidateOperator<I, B, C> next) {
        return v -> next.apply(apply(v));
    }
}
