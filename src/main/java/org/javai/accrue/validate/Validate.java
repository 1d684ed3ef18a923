package org.javai.accrue.validate;

import org.javai.accrue.Context;
import org.javai.accrue.Errors;
import org.javai.accrue.Reader;
import org.javai.accrue.Validation;
import org.javai.accrue.optics.Lens;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * A validator: given an input, produces a {@link Validation} once told the {@link Context}
 * it runs in.
 *
 * <p>Validators are plain functions with no internal state. They are composed with the
 * default methods below, or with the curried operators in {@link Validators}; both build
 * the same thing.
 *
 * <pre>{@code
 * Validate<String, Integer> parsed = Boundary.silent().validator(Integer::parseInt);
 * Validate<String, Integer> port = parsed
 *     .chain(n -> n > 0 ? Validators.of(n) : Validators.failure("must be positive"))
 *     .at("port", "int");
 *
 * port.validate("8080"); // Success(8080)
 * port.validate("-1");   // Failure([at port: must be positive])
 * }</pre>
 *
 * <p>The do-notation methods ({@link #bind}, {@link #let}, {@link #apS}, ...) thread a
 * state object through a pipeline, one field at a time. {@code bind} and {@code let} stop
 * at the first failure. {@code apS} runs its field validator even when the state has
 * already failed and keeps the errors of both.
 *
 * @param <I> The input type
 * @param <A> The validated type
 */
@FunctionalInterface
public interface Validate<I, A> extends Function<I, Reader<Context, Validation<A>>> {

    /**
     * Runs this validator on {@code input} at the given context.
     */
    default Validation<A> validate(I input, Context context) {
        return apply(input).apply(context);
    }

    /**
     * Runs this validator on {@code input} at the root context.
     */
    default Validation<A> validate(I input) {
        return validate(input, Context.empty());
    }

    /**
     * Runs this validator one level deeper: the context gains an entry for
     * {@code key}/{@code type} whose actual value is the input.
     */
    default Validate<I, A> at(String key, String type) {
        return input -> context -> validate(input, context.push(key, type, input));
    }

    /**
     * Runs this validator on a part of a larger input.
     */
    default <J> Validate<J, A> contramap(Function<? super J, ? extends I> extract) {
        Objects.requireNonNull(extract, "extract must not be null");
        return input -> context -> validate(extract.apply(input), context);
    }

    // Functor / monad

    default <B> Validate<I, B> map(Function<? super A, ? extends B> f) {
        Objects.requireNonNull(f, "f must not be null");
        return input -> context -> validate(input, context).map(f);
    }

    /**
     * Feeds the validated value to a validator computed from it, run on the same input
     * and context. Stops at the first failure.
     */
    default <B> Validate<I, B> chain(Function<? super A, ? extends Validate<I, B>> f) {
        Objects.requireNonNull(f, "f must not be null");
        return input -> context -> validate(input, context)
                .chain(a -> f.apply(a).validate(input, context));
    }

    // Failure channel

    default Validate<I, A> chainLeft(Function<? super Errors, ? extends Validate<I, A>> f) {
        Objects.requireNonNull(f, "f must not be null");
        return input -> context -> validate(input, context)
                .chainLeft(errors -> f.apply(errors).validate(input, context));
    }

    default Validate<I, A> orElse(Function<? super Errors, ? extends Validate<I, A>> f) {
        return chainLeft(f);
    }

    /**
     * Tries this validator, then {@code second} if it failed. {@code second} is obtained
     * only when needed.
     */
    default Validate<I, A> alt(Supplier<? extends Validate<I, A>> second) {
        Objects.requireNonNull(second, "second must not be null");
        return chainLeft(ignored -> second.get());
    }

    /**
     * Applies the function validated by {@code fab} to this validator's value, running both.
     * Errors of {@code fab} come before errors of this validator.
     */
    default <B> Validate<I, B> ap(Validate<I, ? extends Function<? super A, ? extends B>> fab) {
        return Validators.monadAp(fab, this);
    }

    // Do-notation

    default <S2, T> Validate<I, S2> bind(Function<T, Function<A, S2>> setter, Function<A, Validate<I, T>> f) {
        Objects.requireNonNull(setter, "setter must not be null");
        Objects.requireNonNull(f, "f must not be null");
        return chain(s1 -> f.apply(s1).map(t -> setter.apply(t).apply(s1)));
    }

    default <S2, B> Validate<I, S2> let(Function<B, Function<A, S2>> setter, Function<A, B> f) {
        Objects.requireNonNull(setter, "setter must not be null");
        Objects.requireNonNull(f, "f must not be null");
        return map(s1 -> setter.apply(f.apply(s1)).apply(s1));
    }

    default <S2, B> Validate<I, S2> letTo(Function<B, Function<A, S2>> setter, B b) {
        Objects.requireNonNull(setter, "setter must not be null");
        return map(s1 -> setter.apply(b).apply(s1));
    }

    default <S> Validate<I, S> bindTo(Function<A, S> constructor) {
        return map(constructor);
    }

    default <S2, T> Validate<I, S2> apS(Function<T, Function<A, S2>> setter, Validate<I, T> fa) {
        Objects.requireNonNull(setter, "setter must not be null");
        Objects.requireNonNull(fa, "fa must not be null");
        return input -> context -> Validation.monadAp(
                validate(input, context).map(s1 -> (Function<T, S2>) t -> setter.apply(t).apply(s1)),
                fa.validate(input, context));
    }

    default <T> Validate<I, A> apSL(Lens<A, T> lens, Validate<I, T> fa) {
        Objects.requireNonNull(lens, "lens must not be null");
        return this.<A, T>apS(t -> s -> lens.set(s, t), fa);
    }

    /**
     * Like {@link #bind} but reads and writes the field through a lens; {@code f} receives
     * the current field value.
     */
    default <T> Validate<I, A> bindL(Lens<A, T> lens, Function<T, Validate<I, T>> f) {
        Objects.requireNonNull(lens, "lens must not be null");
        Objects.requireNonNull(f, "f must not be null");
        return this.<A, T>bind(t -> s -> lens.set(s, t), s -> f.apply(lens.get(s)));
    }

    default <T> Validate<I, A> letL(Lens<A, T> lens, UnaryOperator<T> f) {
        Objects.requireNonNull(lens, "lens must not be null");
        Objects.requireNonNull(f, "f must not be null");
        return this.<A, T>let(t -> s -> lens.set(s, t), s -> f.apply(lens.get(s)));
    }

    default <T> Validate<I, A> letToL(Lens<A, T> lens, T b) {
        Objects.requireNonNull(lens, "lens must not be null");
        return this.<A, T>letTo(t -> s -> lens.set(s, t), b);
    }
}
