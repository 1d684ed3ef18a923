package org.javai.accrue.optics;

import org.javai.accrue.Option;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * An accessor for one case of a sum type: {@link #getOption} matches the case and extracts
 * its payload, {@link #reverseGet} builds the sum type from a payload.
 *
 * <p>Law: {@code getOption(reverseGet(a)) == Some(a)}.
 *
 * <pre>{@code
 * Prism<Shape, Circle> circle = Prism.instanceOf(Shape.class, Circle.class);
 * circle.getOption(new Square(2)); // None
 * circle.getOption(new Circle(1)); // Some(Circle[radius=1])
 * }</pre>
 *
 * @param <S> The sum type
 * @param <A> The payload of the matched case
 */
public final class Prism<S, A> {

    private final Function<S, Option<A>> getOption;
    private final Function<A, S> reverseGet;
    private final String name;

    private Prism(Function<S, Option<A>> getOption, Function<A, S> reverseGet, String name) {
        this.getOption = Objects.requireNonNull(getOption, "getOption must not be null");
        this.reverseGet = Objects.requireNonNull(reverseGet, "reverseGet must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public static <S, A> Prism<S, A> of(Function<S, Option<A>> getOption, Function<A, S> reverseGet) {
        return new Prism<>(getOption, reverseGet, "Prism");
    }

    public static <S, A> Prism<S, A> of(Function<S, Option<A>> getOption, Function<A, S> reverseGet, String name) {
        return new Prism<>(getOption, reverseGet, name);
    }

    /**
     * Matches values satisfying the predicate; {@code reverseGet} is the identity.
     */
    public static <S> Prism<S, S> fromPredicate(Predicate<? super S> predicate) {
        return new Prism<>(Option.fromPredicate(predicate), Function.identity(), "FromPredicate");
    }

    /**
     * Matches values of the subtype {@code type}.
     */
    public static <S, A extends S> Prism<S, A> instanceOf(Class<S> superType, Class<A> type) {
        Objects.requireNonNull(superType, "superType must not be null");
        Objects.requireNonNull(type, "type must not be null");
        return new Prism<>(
                s -> type.isInstance(s) ? Option.some(type.cast(s)) : Option.none(),
                superType::cast,
                "InstanceOf[" + type.getSimpleName() + "]");
    }

    public static <S> Prism<S, S> id() {
        return new Prism<>(Option::ofNullable, Function.identity(), "Identity");
    }

    public Option<A> getOption(S s) {
        return getOption.apply(s);
    }

    public S reverseGet(A a) {
        return reverseGet.apply(a);
    }

    /**
     * Replaces the payload when {@code s} matches; returns {@code s} unchanged otherwise.
     */
    public S set(S s, A a) {
        return getOption(s).isSome() ? reverseGet(a) : s;
    }

    public UnaryOperator<S> set(A a) {
        return s -> set(s, a);
    }

    public S modify(S s, UnaryOperator<A> f) {
        Objects.requireNonNull(f, "f must not be null");
        return getOption(s).fold(() -> s, a -> reverseGet(f.apply(a)));
    }

    public <B> Prism<S, B> compose(Prism<A, B> inner) {
        Objects.requireNonNull(inner, "inner must not be null");
        return new Prism<>(
                s -> getOption(s).chain(inner::getOption),
                b -> reverseGet(inner.reverseGet(b)),
                "PrismCompose[" + name + " -> " + inner.name + "]");
    }

    /**
     * Views this prism as an optional: the focus is the payload when the case matches.
     */
    public Optional<S, A> asOptional() {
        return Optional.of(getOption, this::set, "PrismAsOptional[" + name + "]");
    }

    /**
     * Changes the payload type through an isomorphism {@code ab}/{@code ba}.
     */
    public <B> Prism<S, B> imap(Function<A, B> ab, Function<B, A> ba) {
        Objects.requireNonNull(ab, "ab must not be null");
        Objects.requireNonNull(ba, "ba must not be null");
        return new Prism<>(s -> getOption(s).map(ab), b -> reverseGet(ba.apply(b)), name);
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
