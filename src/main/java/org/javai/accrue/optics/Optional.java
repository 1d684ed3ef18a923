package org.javai.accrue.optics;

import org.javai.accrue.Option;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * A partial, composable accessor: an {@code S} may or may not contain an {@code A}.
 *
 * <p>Setting through an optional whose focus is absent returns the structure unchanged.
 * Every factory enforces this by checking {@link #getOption} on the structure being
 * written before calling the underlying setter, so a careless setter cannot break it.
 *
 * <p>Laws: when {@code getOption(s)} is none, {@code set(s, a) == s}; otherwise
 * {@code getOption(set(s, a)) == Some(a)} and {@code set(set(s, a1), a2) == set(s, a2)}.
 *
 * <p>Not to be confused with {@link java.util.Optional}; absence of a value is modelled by
 * {@link Option}.
 *
 * @param <S> The structure type
 * @param <A> The focused type
 */
public final class Optional<S, A> {

    private final Function<S, Option<A>> getOption;
    private final BiFunction<S, A, S> setter;
    private final String name;

    private Optional(Function<S, Option<A>> getOption, BiFunction<S, A, S> setter, String name) {
        this.getOption = Objects.requireNonNull(getOption, "getOption must not be null");
        this.setter = Objects.requireNonNull(setter, "setter must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public static <S, A> Optional<S, A> of(Function<S, Option<A>> getOption, BiFunction<S, A, S> setter) {
        return of(getOption, setter, "Optional");
    }

    public static <S, A> Optional<S, A> of(Function<S, Option<A>> getOption, BiFunction<S, A, S> setter, String name) {
        Objects.requireNonNull(getOption, "getOption must not be null");
        Objects.requireNonNull(setter, "setter must not be null");
        return new Optional<>(
                getOption,
                (s, a) -> getOption.apply(s).isSome() ? setter.apply(s, a) : s,
                name);
    }

    /**
     * Builds an optional whose {@code getOption} is always some, so the absent-focus check
     * can never apply and {@code setter} is used as is.
     */
    static <S, A> Optional<S, A> total(Function<S, Option<A>> getOption, BiFunction<S, A, S> setter, String name) {
        return new Optional<>(getOption, setter, name);
    }

    public static <S, A> Optional<S, A> curried(Function<S, Option<A>> getOption, Function<A, UnaryOperator<S>> setter) {
        Objects.requireNonNull(setter, "setter must not be null");
        return of(getOption, (s, a) -> setter.apply(a).apply(s));
    }

    /**
     * Creates an optional over a mutable structure. A null structure has no focus and is
     * returned unchanged by {@code set}. Otherwise {@code set} copies the structure with
     * {@code copier} and applies {@code mutator} to the copy; the caller's instance is never
     * modified.
     */
    public static <S, A> Optional<S, A> ref(Function<S, Option<A>> getOption, BiConsumer<S, A> mutator,
                                            UnaryOperator<S> copier) {
        Objects.requireNonNull(getOption, "getOption must not be null");
        Objects.requireNonNull(mutator, "mutator must not be null");
        Objects.requireNonNull(copier, "copier must not be null");
        return of(
                s -> s == null ? Option.none() : getOption.apply(s),
                (s, a) -> {
                    S copy = copier.apply(s);
                    mutator.accept(copy, a);
                    return copy;
                },
                "OptionalRef");
    }

    /**
     * An optional over a field that only counts as present when it satisfies
     * {@code predicate}.
     *
     * <pre>{@code
     * Optional<Person, Integer> adultAge = Optional.fromPredicate(age -> age >= 18, Person::age, Person::withAge);
     * }</pre>
     */
    public static <S, A> Optional<S, A> fromPredicate(Predicate<? super A> predicate, Function<S, A> getter,
                                                      BiFunction<S, A, S> setter) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(getter, "getter must not be null");
        Function<A, Option<A>> matching = Option.fromPredicate(predicate);
        return of(s -> matching.apply(getter.apply(s)), setter, "FromPredicate");
    }

    /**
     * {@link #fromPredicate} over a mutable structure, with the copy-before-write and
     * null handling of {@link #ref}.
     */
    public static <S, A> Optional<S, A> fromPredicateRef(Predicate<? super A> predicate, Function<S, A> getter,
                                                         BiConsumer<S, A> mutator, UnaryOperator<S> copier) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(getter, "getter must not be null");
        Function<A, Option<A>> matching = Option.fromPredicate(predicate);
        return ref(s -> matching.apply(getter.apply(s)), mutator, copier);
    }

    public static <S> Optional<S, S> id() {
        return of(Option::ofNullable, (s, a) -> a, "Identity");
    }

    public Option<A> getOption(S s) {
        return getOption.apply(s);
    }

    public S set(S s, A a) {
        return setter.apply(s, a);
    }

    public UnaryOperator<S> set(A a) {
        return s -> setter.apply(s, a);
    }

    /**
     * Applies {@code f} to the focus if present; returns the structure unchanged otherwise.
     */
    public S modify(S s, UnaryOperator<A> f) {
        return modifyOption(s, f).getOrElse(s);
    }

    /**
     * Applies {@code f} to the focus if present; {@link Option#none()} signals that there was
     * nothing to modify.
     */
    public Option<S> modifyOption(S s, UnaryOperator<A> f) {
        Objects.requireNonNull(f, "f must not be null");
        return getOption(s).map(a -> set(s, f.apply(a)));
    }

    public Option<S> setOption(S s, A a) {
        return modifyOption(s, ignored -> a);
    }

    /**
     * Focuses deeper. Misses as soon as either stage misses.
     */
    public <B> Optional<S, B> compose(Optional<A, B> inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        return of(
                s -> getOption(s).chain(inner::getOption),
                (s, b) -> modify(s, a -> inner.set(a, b)),
                "OptionalCompose[" + name + " -> " + inner.name + "]");
    }

    public <B> Optional<S, B> compose(Lens<A, B> inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        return compose(inner.asOptional());
    }

    public <B> Optional<S, B> compose(Prism<A, B> inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        return compose(inner.asOptional());
    }

    /**
     * Changes the focused type through an isomorphism {@code ab}/{@code ba}.
     */
    public <B> Optional<S, B> imap(Function<A, B> ab, Function<B, A> ba) {
        Objects.requireNonNull(ab, "ab must not be null");
        Objects.requireNonNull(ba, "ba must not be null");
        return of(s -> getOption(s).map(ab), (s, b) -> set(s, ba.apply(b)), name);
    }

    /**
     * Changes the focused type through a pair of partial conversions. A {@code B} that does
     * not convert back leaves the structure unchanged.
     */
    public <B> Optional<S, B> ichain(Function<A, Option<B>> ab, Function<B, Option<A>> ba) {
        Objects.requireNonNull(ab, "ab must not be null");
        Objects.requireNonNull(ba, "ba must not be null");
        return of(s -> getOption(s).chain(ab), (s, b) -> ba.apply(b).fold(() -> s, a -> set(s, a)), name);
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
