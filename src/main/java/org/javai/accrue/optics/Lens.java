package org.javai.accrue.optics;

import org.javai.accrue.Option;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * A total, composable accessor: every {@code S} has an {@code A} that can be read and
 * replaced, producing a new {@code S}.
 *
 * <p>A lawful lens satisfies:
 * <ul>
 *   <li>GetSet: {@code get(set(s, a)) == a}</li>
 *   <li>SetGet: {@code set(s, get(s)) == s}</li>
 *   <li>SetSet: {@code set(set(s, a1), a2) == set(s, a2)}</li>
 * </ul>
 *
 * <pre>{@code
 * Lens<Person, Address> address = Lens.of(Person::address, Person::withAddress);
 * Lens<Address, String> city = Lens.of(Address::city, Address::withCity);
 *
 * Lens<Person, String> personCity = address.compose(city);
 * Person moved = personCity.set(alice, "Paris");
 * }</pre>
 *
 * @param <S> The structure type
 * @param <A> The focused type
 */
public final class Lens<S, A> {

    private final Function<S, A> getter;
    private final BiFunction<S, A, S> setter;
    private final String name;

    private Lens(Function<S, A> getter, BiFunction<S, A, S> setter, String name) {
        this.getter = Objects.requireNonNull(getter, "getter must not be null");
        this.setter = Objects.requireNonNull(setter, "setter must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public static <S, A> Lens<S, A> of(Function<S, A> getter, BiFunction<S, A, S> setter) {
        return new Lens<>(getter, setter, "Lens");
    }

    public static <S, A> Lens<S, A> of(Function<S, A> getter, BiFunction<S, A, S> setter, String name) {
        return new Lens<>(getter, setter, name);
    }

    /**
     * Creates a lens from a curried setter: value first, then the structure.
     */
    public static <S, A> Lens<S, A> curried(Function<S, A> getter, Function<A, UnaryOperator<S>> setter) {
        Objects.requireNonNull(setter, "setter must not be null");
        return new Lens<>(getter, (s, a) -> setter.apply(a).apply(s), "Lens");
    }

    /**
     * Creates a lens over a mutable structure without ever mutating the caller's instance.
     * {@code set} copies the structure with {@code copier} and applies {@code mutator} to the
     * copy. A null structure is replaced by a fresh one from {@code empty}, for both reads
     * and writes, so the lens stays total.
     *
     * <pre>{@code
     * Lens<MutableConfig, Integer> port = Lens.ref(
     *     MutableConfig::getPort, MutableConfig::setPort, MutableConfig::new, MutableConfig::new);
     * }</pre>
     */
    public static <S, A> Lens<S, A> ref(Function<S, A> getter, BiConsumer<S, A> mutator,
                                        UnaryOperator<S> copier, Supplier<S> empty) {
        Objects.requireNonNull(getter, "getter must not be null");
        Objects.requireNonNull(mutator, "mutator must not be null");
        Objects.requireNonNull(copier, "copier must not be null");
        Objects.requireNonNull(empty, "empty must not be null");
        return new Lens<>(
                s -> getter.apply(s == null ? empty.get() : s),
                (s, a) -> {
                    S copy = s == null ? empty.get() : copier.apply(s);
                    mutator.accept(copy, a);
                    return copy;
                },
                "LensRef");
    }

    public static <S> Lens<S, S> id() {
        return new Lens<>(Function.identity(), (s, a) -> a, "Identity");
    }

    public A get(S s) {
        return getter.apply(s);
    }

    public S set(S s, A a) {
        return setter.apply(s, a);
    }

    /**
     * The setter with the value fixed: {@code set(a).apply(s) == set(s, a)}.
     */
    public UnaryOperator<S> set(A a) {
        return s -> setter.apply(s, a);
    }

    public S modify(S s, UnaryOperator<A> f) {
        Objects.requireNonNull(f, "f must not be null");
        return set(s, f.apply(get(s)));
    }

    public UnaryOperator<S> modify(UnaryOperator<A> f) {
        Objects.requireNonNull(f, "f must not be null");
        return s -> modify(s, f);
    }

    /**
     * Focuses deeper: reads through this lens then {@code inner}; writes by reading the
     * current {@code A}, replacing its {@code B}, and writing the new {@code A} back.
     */
    public <B> Lens<S, B> compose(Lens<A, B> inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        return new Lens<>(
                s -> inner.get(get(s)),
                (s, b) -> set(s, inner.set(get(s), b)),
                "LensCompose[" + name + " -> " + inner.name + "]");
    }

    public <B> Optional<S, B> compose(Optional<A, B> inner) {
        return asOptional().compose(inner);
    }

    /**
     * Composes with a prism. The result is partial: it misses wherever the prism does not
     * match, and setting through a miss leaves the structure unchanged.
     */
    public <B> Optional<S, B> compose(Prism<A, B> prism) {
        Objects.requireNonNull(prism, "prism must not be null");
        return asOptional().compose(prism.asOptional());
    }

    /**
     * Views this lens as an optional that always finds its focus, including a null one, and
     * always writes through {@link #set}.
     */
    public Optional<S, A> asOptional() {
        return Optional.total(s -> Option.some(get(s)), this::set, "LensAsOptional[" + name + "]");
    }

    /**
     * Changes the focused type through an isomorphism {@code ab}/{@code ba}.
     */
    public <B> Lens<S, B> imap(Function<A, B> ab, Function<B, A> ba) {
        Objects.requireNonNull(ab, "ab must not be null");
        Objects.requireNonNull(ba, "ba must not be null");
        return new Lens<>(s -> ab.apply(get(s)), (s, b) -> set(s, ba.apply(b)), name);
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
