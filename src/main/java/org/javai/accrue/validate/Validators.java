package org.javai.accrue.validate;

import org.javai.accrue.Context;
import org.javai.accrue.Errors;
import org.javai.accrue.Result;
import org.javai.accrue.Validation;
import org.javai.accrue.Validations;
import org.javai.accrue.optics.Lens;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Factories for {@link Validate} values and curried {@link ValidateOperator}s.
 *
 * <p>The operator factories ({@link #map}, {@link #bind}, {@link #apS}, ...) mirror the
 * default methods of {@link Validate}; the {@code monad*} factories take the validator as
 * their first argument. A pipeline can be written either way:
 *
 * <pre>{@code
 * Validate<Input, State> v1 = Validators.<Input, State>start(State.EMPTY)
 *     .bind(State.setX, s -> validateX)
 *     .apS(State.setY, validateY);
 *
 * Validate<Input, State> v2 = Validators.<Input, State, State, Integer>bind(State.setX, s -> validateX)
 *     .then(Validators.apS(State.setY, validateY))
 *     .apply(Validators.start(State.EMPTY));
 * }</pre>
 */
public final class Validators {

    /**
     * The message recorded when a function reporting a plain error is lifted into a validator.
     */
    public static final String UNABLE_TO_DECODE = "unable to decode";

    private Validators() {}

    // Construction

    public static <I, A> Validate<I, A> of(A value) {
        return input -> context -> Validation.of(value);
    }

    /**
     * A validator that always fails with {@code message}, recording the input as the
     * offending value.
     */
    public static <I, A> Validate<I, A> failure(String message) {
        Objects.requireNonNull(message, "message must not be null");
        return input -> Validation.failureWithMessage(input, message);
    }

    /**
     * Accepts inputs that satisfy the predicate; rejects the rest with a message computed
     * from the input.
     */
    public static <I> Validate<I, I> fromPredicate(Predicate<? super I> predicate, Function<? super I, String> message) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(message, "message must not be null");
        return input -> predicate.test(input)
                ? (context -> Validation.of(input))
                : Validation.failureWithMessage(input, message.apply(input));
    }

    /**
     * Lifts an error-or-value function into a validator. An error becomes a single
     * {@link org.javai.accrue.ValidationError} with message {@value #UNABLE_TO_DECODE}, the
     * input as value, the current context, and the error as cause.
     */
    public static <I, A> Validate<I, A> fromReaderResult(Function<? super I, Result<A>> f) {
        Objects.requireNonNull(f, "f must not be null");
        return input -> context -> f.apply(input).fold(
                error -> Validation.<A>failureWithError(input, UNABLE_TO_DECODE).apply(error).apply(context),
                Validation::of);
    }

    /**
     * Runs a validator at the root context and collapses its errors into a single
     * {@link org.javai.accrue.ValidationErrorsException}.
     */
    public static <I, A> Function<I, Result<A>> toResult(Validate<I, A> v) {
        Objects.requireNonNull(v, "v must not be null");
        return input -> v.validate(input, Context.empty()).toResult();
    }

    /**
     * Runs every validator on the same input and collects the values, keeping every error.
     */
    public static <I, A> Validate<I, List<A>> sequence(List<? extends Validate<I, A>> validators) {
        Objects.requireNonNull(validators, "validators must not be null");
        List<Validate<I, A>> copy = List.copyOf(validators);
        return input -> context -> {
            List<Validation<A>> results = new ArrayList<>(copy.size());
            for (Validate<I, A> v : copy) {
                results.add(v.validate(input, context));
            }
            return Validations.sequence(results);
        };
    }

    // Monad-style: the validator comes first

    public static <I, A, B> Validate<I, B> monadMap(Validate<I, A> fa, Function<? super A, ? extends B> f) {
        return fa.map(f);
    }

    public static <I, A, B> Validate<I, B> monadChain(Validate<I, A> fa, Function<? super A, ? extends Validate<I, B>> f) {
        return fa.chain(f);
    }

    public static <I, A> Validate<I, A> monadChainLeft(Validate<I, A> fa, Function<? super Errors, ? extends Validate<I, A>> f) {
        return fa.chainLeft(f);
    }

    /**
     * Runs both validators on the same input and context and applies the function to the
     * value. Errors of both sides are kept, the function side's first.
     */
    public static <I, A, B> Validate<I, B> monadAp(Validate<I, ? extends Function<? super A, ? extends B>> fab, Validate<I, A> fa) {
        Objects.requireNonNull(fab, "fab must not be null");
        Objects.requireNonNull(fa, "fa must not be null");
        return input -> context -> Validation.monadAp(fab.validate(input, context), fa.validate(input, context));
    }

    public static <I, A> Validate<I, A> monadAlt(Validate<I, A> first, Supplier<? extends Validate<I, A>> second) {
        return first.alt(second);
    }

    // Curried operators

    public static <I, A, B> ValidateOperator<I, A, B> map(Function<? super A, ? extends B> f) {
        Objects.requireNonNull(f, "f must not be null");
        return fa -> fa.map(f);
    }

    public static <I, A, B> ValidateOperator<I, A, B> chain(Function<? super A, ? extends Validate<I, B>> f) {
        Objects.requireNonNull(f, "f must not be null");
        return fa -> fa.chain(f);
    }

    public static <I, A> ValidateOperator<I, A, A> chainLeft(Function<? super Errors, ? extends Validate<I, A>> f) {
        Objects.requireNonNull(f, "f must not be null");
        return fa -> fa.chainLeft(f);
    }

    public static <I, A> ValidateOperator<I, A, A> orElse(Function<? super Errors, ? extends Validate<I, A>> f) {
        return chainLeft(f);
    }

    public static <I, A, B> ValidateOperator<I, Function<A, B>, B> ap(Validate<I, A> fa) {
        Objects.requireNonNull(fa, "fa must not be null");
        return fab -> monadAp(fab, fa);
    }

    public static <I, A> ValidateOperator<I, A, A> alt(Supplier<? extends Validate<I, A>> second) {
        Objects.requireNonNull(second, "second must not be null");
        return first -> first.alt(second);
    }

    // Do-notation

    /**
     * Starts a do-notation pipeline. Always succeeds with {@code initial}.
     */
    public static <I, S> Validate<I, S> start(S initial) {
        return of(initial);
    }

    public static <I, S1, S2, T> ValidateOperator<I, S1, S2> bind(Function<T, Function<S1, S2>> setter, Function<S1, Validate<I, T>> f) {
        return v -> v.bind(setter, f);
    }

    public static <I, S1, S2, B> ValidateOperator<I, S1, S2> let(Function<B, Function<S1, S2>> setter, Function<S1, B> f) {
        return v -> v.let(setter, f);
    }

    public static <I, S1, S2, B> ValidateOperator<I, S1, S2> letTo(Function<B, Function<S1, S2>> setter, B b) {
        return v -> v.letTo(setter, b);
    }

    public static <I, T, S> ValidateOperator<I, T, S> bindTo(Function<T, S> constructor) {
        Objects.requireNonNull(constructor, "constructor must not be null");
        return v -> v.bindTo(constructor);
    }

    public static <I, S1, S2, T> ValidateOperator<I, S1, S2> apS(Function<T, Function<S1, S2>> setter, Validate<I, T> fa) {
        return v -> v.apS(setter, fa);
    }

    public static <I, S, T> ValidateOperator<I, S, S> apSL(Lens<S, T> lens, Validate<I, T> fa) {
        return v -> v.apSL(lens, fa);
    }

    public static <I, S, T> ValidateOperator<I, S, S> bindL(Lens<S, T> lens, Function<T, Validate<I, T>> f) {
        return v -> v.bindL(lens, f);
    }

    public static <I, S, T> ValidateOperator<I, S, S> letL(Lens<S, T> lens, UnaryOperator<T> f) {
        return v -> v.letL(lens, f);
    }

    public static <I, S, T> ValidateOperator<I, S, S> letToL(Lens<S, T> lens, T b) {
        return v -> v.letToL(lens, b);
    }
}
