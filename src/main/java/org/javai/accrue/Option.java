package org.javai.accrue;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * An optional value: either {@link Some} holding a value, or {@link None}.
 *
 * <p>Used wherever a lookup may legitimately find nothing, most notably by the partial
 * optics in {@link org.javai.accrue.optics}. Absence is a value, never {@code null}.
 *
 * @param <A> The type of the contained value
 */
public sealed interface Option<A> permits Option.Some, Option.None {

    /**
     * A present value. The value itself may be {@code null}: a total lens viewed as an
     * optional always has a focus, even when the field it reads is null. Use
     * {@link #ofNullable} to treat null as absent.
     *
     * @param value the value
     */
    record Some<A>(A value) implements Option<A> {

        @Override
        public boolean isSome() {
            return true;
        }

        @Override
        public <B> Option<B> map(Function<? super A, ? extends B> mapper) {
            Objects.requireNonNull(mapper);
            return ofNullable(mapper.apply(value));
        }

        @Override
        public <B> Option<B> chain(Function<? super A, ? extends Option<B>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Option<A> filter(Predicate<? super A> predicate) {
            return predicate.test(value) ? this : none();
        }

        @Override
        public <B> B fold(Supplier<? extends B> onNone, Function<? super A, ? extends B> onSome) {
            return onSome.apply(value);
        }

        @Override
        public A getOrElse(A defaultValue) {
            return value;
        }

        @Override
        public Option<A> orElse(Supplier<? extends Option<A>> alternative) {
            return this;
        }
    }

    /**
     * The absent value.
     */
    record None<A>() implements Option<A> {

        @Override
        public boolean isSome() {
            return false;
        }

        @Override
        public <B> Option<B> map(Function<? super A, ? extends B> mapper) {
            return none();
        }

        @Override
        public <B> Option<B> chain(Function<? super A, ? extends Option<B>> mapper) {
            return none();
        }

        @Override
        public Option<A> filter(Predicate<? super A> predicate) {
            return this;
        }

        @Override
        public <B> B fold(Supplier<? extends B> onNone, Function<? super A, ? extends B> onSome) {
            return onNone.get();
        }

        @Override
        public A getOrElse(A defaultValue) {
            return defaultValue;
        }

        @Override
        public Option<A> orElse(Supplier<? extends Option<A>> alternative) {
            Objects.requireNonNull(alternative);
            return alternative.get();
        }
    }

    boolean isSome();

    default boolean isNone() {
        return !isSome();
    }

    <B> Option<B> map(Function<? super A, ? extends B> mapper);

    <B> Option<B> chain(Function<? super A, ? extends Option<B>> mapper);

    Option<A> filter(Predicate<? super A> predicate);

    <B> B fold(Supplier<? extends B> onNone, Function<? super A, ? extends B> onSome);

    A getOrElse(A defaultValue);

    /**
     * Returns this option if present, otherwise the lazily computed alternative.
     */
    Option<A> orElse(Supplier<? extends Option<A>> alternative);

    default java.util.Optional<A> toOptional() {
        return fold(java.util.Optional::empty, java.util.Optional::ofNullable);
    }

    static <A> Option<A> some(A value) {
        return new Some<>(value);
    }

    static <A> Option<A> none() {
        return new None<>();
    }

    static <A> Option<A> ofNullable(A value) {
        return value == null ? none() : some(value);
    }

    /**
     * Returns a function that wraps values satisfying the predicate in {@link Some}
     * and maps everything else, including {@code null}, to {@link None}.
     */
    static <A> Function<A, Option<A>> fromPredicate(Predicate<? super A> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return a -> a != null && predicate.test(a) ? some(a) : none();
    }
}
