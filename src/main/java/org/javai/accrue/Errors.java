package org.javai.accrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An ordered, immutable sequence of {@link ValidationError}s.
 *
 * <p>Order reflects the order in which failures were produced: left to right across
 * applicative and alternative combinators. Errors form a monoid under {@link #concat}
 * with {@link #empty()} as identity.
 */
public final class Errors implements Iterable<ValidationError> {

    private static final Errors EMPTY = new Errors(List.of());

    private static final Monoid<Errors> MONOID = Monoid.of(EMPTY, Errors::concat);

    private final List<ValidationError> errors;

    private Errors(List<ValidationError> errors) {
        this.errors = errors;
    }

    public static Errors empty() {
        return EMPTY;
    }

    public static Errors of(ValidationError... errors) {
        return from(Arrays.asList(errors));
    }

    public static Errors from(List<ValidationError> errors) {
        Objects.requireNonNull(errors, "errors must not be null");
        if (errors.isEmpty()) {
            return EMPTY;
        }
        return new Errors(List.copyOf(errors));
    }

    /**
     * The concatenation monoid.
     */
    public static Monoid<Errors> monoid() {
        return MONOID;
    }

    /**
     * Returns the errors of this sequence followed by the errors of {@code other}.
     */
    public Errors concat(Errors other) {
        Objects.requireNonNull(other, "other must not be null");
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<ValidationError> all = new ArrayList<>(errors.size() + other.errors.size());
        all.addAll(errors);
        all.addAll(other.errors);
        return new Errors(Collections.unmodifiableList(all));
    }

    public int size() {
        return errors.size();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public ValidationError get(int index) {
        return errors.get(index);
    }

    public List<ValidationError> asList() {
        return errors;
    }

    public List<String> messages() {
        return errors.stream().map(ValidationError::message).collect(Collectors.toUnmodifiableList());
    }

    public Stream<ValidationError> stream() {
        return errors.stream();
    }

    @Override
    public Iterator<ValidationError> iterator() {
        return errors.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Errors)) {
            return false;
        }
        return errors.equals(((Errors) o).errors);
    }

    @Override
    public int hashCode() {
        return errors.hashCode();
    }

    @Override
    public String toString() {
        return errors.toString();
    }
}
