package org.javai.accrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Curried, pipeline-friendly forms of the {@link Validation} operations, plus the monoids
 * that combine validations.
 *
 * <p>Each factory returns an {@link Operator}, a function from one validation to another,
 * so that operations can be prepared once and applied later:
 *
 * <pre>{@code
 * Validations.Operator<String, Integer> length = Validations.map(String::length);
 * length.apply(Validation.success("four")); // Success(4)
 * }</pre>
 */
public final class Validations {

    private Validations() {}

    /**
     * A transformation from a validated {@code A} to a validated {@code B}.
     */
    @FunctionalInterface
    public interface Operator<A, B> extends Function<Validation<A>, Validation<B>> {
    }

    public static <A, B> Operator<A, B> map(Function<? super A, ? extends B> f) {
        Objects.requireNonNull(f, "f must not be null");
        return fa -> fa.map(f);
    }

    public static <A, B> Operator<A, B> chain(Function<? super A, ? extends Validation<B>> f) {
        Objects.requireNonNull(f, "f must not be null");
        return fa -> fa.chain(f);
    }

    /**
     * Applies the validated function it receives to {@code fa}, accumulating errors.
     */
    public static <A, B> Operator<Function<? super A, ? extends B>, B> ap(Validation<A> fa) {
        Objects.requireNonNull(fa, "fa must not be null");
        return fab -> Validation.monadAp(fab, fa);
    }

    public static <A> Operator<A, A> chainLeft(Function<? super Errors, ? extends Validation<A>> f) {
        Objects.requireNonNull(f, "f must not be null");
        return fa -> fa.chainLeft(f);
    }

    public static <A> Operator<A, A> orElse(Function<? super Errors, ? extends Validation<A>> f) {
        return chainLeft(f);
    }

    public static <A> Operator<A, A> alt(Supplier<? extends Validation<A>> second) {
        Objects.requireNonNull(second, "second must not be null");
        return first -> first.alt(second);
    }

    /**
     * Turns a list of validations into a validation of a list, keeping every error.
     */
    public static <A> Validation<List<A>> sequence(List<Validation<A>> validations) {
        Objects.requireNonNull(validations, "validations must not be null");
        Errors errors = Errors.empty();
        List<A> values = new ArrayList<>(validations.size());
        for (Validation<A> v : validations) {
            if (v.isSuccess()) {
                values.add(v.getOrThrow());
            } else {
                errors = errors.concat(v.errors());
            }
        }
        return errors.isEmpty() ? Validation.success(values) : Validation.failures(errors);
    }

    // Monoids

    public static Monoid<Errors> errorsMonoid() {
        return Errors.monoid();
    }

    /**
     * Combines the values of two successes with {@code m}; any failure accumulates.
     */
    public static <A> Monoid<Validation<A>> applicativeMonoid(Monoid<A> m) {
        Objects.requireNonNull(m, "m must not be null");
        return Monoid.lazy(
                () -> Validation.of(m.empty()),
                (first, second) -> Validation.monadAp(
                        first.map(a -> (Function<A, A>) b -> m.concat(a, b)),
                        second));
    }

    /**
     * Combines two successes with {@code m}, falls back to whichever side succeeded when
     * only one did, and accumulates errors when both failed.
     */
    public static <A> Monoid<Validation<A>> alternativeMonoid(Monoid<A> m) {
        Monoid<Validation<A>> applicative = applicativeMonoid(m);
        return Monoid.lazy(
                applicative::empty,
                (first, second) -> {
                    if (first.isSuccess() != second.isSuccess()) {
                        return first.isSuccess() ? first : second;
                    }
                    return applicative.concat(first, second);
                });
    }

    /**
     * First success wins. The identity is the lazily computed {@code zero}.
     */
    public static <A> Monoid<Validation<A>> altMonoid(Supplier<? extends Validation<A>> zero) {
        Objects.requireNonNull(zero, "zero must not be null");
        return Monoid.lazy(zero, (first, second) -> first.alt(() -> second));
    }
}
