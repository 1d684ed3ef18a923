package org.javai.accrue.validate;

import org.javai.accrue.Monoid;
import org.javai.accrue.Validation;
import org.javai.accrue.Validations;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Three ways to combine two validators into one.
 *
 * <ul>
 *   <li>{@link #applicativeMonoid}: merge both values, report every problem.</li>
 *   <li>{@link #alternativeMonoid}: merge when both succeed, tolerate a one-sided failure.</li>
 *   <li>{@link #altMonoid}: first success wins; escalate only when everything fails.</li>
 * </ul>
 *
 * <p>All three run the combined validators on the same input and context and accumulate
 * errors with {@link org.javai.accrue.Errors#concat}, so error order is always left
 * operand first.
 */
public final class ValidateMonoids {

    private ValidateMonoids() {}

    /**
     * {@code empty} always succeeds with {@code m.empty()}. {@code concat} runs both
     * validators; two successes are combined with {@code m}, any failure accumulates.
     */
    public static <I, A> Monoid<Validate<I, A>> applicativeMonoid(Monoid<A> m) {
        return lift(Validations.applicativeMonoid(m));
    }

    /**
     * Like {@link #applicativeMonoid}, except that when exactly one side fails the other
     * side's success is returned and no error is reported.
     */
    public static <I, A> Monoid<Validate<I, A>> alternativeMonoid(Monoid<A> m) {
        return lift(Validations.alternativeMonoid(m));
    }

    /**
     * {@code empty} is the validator produced by {@code zero}, obtained each time it runs.
     * {@code concat(v1, v2)} returns v1's success without running v2; otherwise v2's
     * success, or the errors of both.
     */
    public static <I, A> Monoid<Validate<I, A>> altMonoid(Supplier<? extends Validate<I, A>> zero) {
        Objects.requireNonNull(zero, "zero must not be null");
        Validate<I, A> empty = input -> context -> zero.get().validate(input, context);
        return Monoid.of(empty, (first, second) -> first.alt(() -> second));
    }

    private static <I, A> Monoid<Validate<I, A>> lift(Monoid<Validation<A>> inner) {
        Validate<I, A> empty = input -> context -> inner.empty();
        return Monoid.of(empty, (first, second) -> input -> context -> inner.concat(
                first.validate(input, context),
                second.validate(input, context)));
    }
}
