package org.javai.accrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stock {@link Monoid} instances.
 */
public final class Monoids {

    private static final Monoid<String> STRING_CONCAT = Monoid.of("", String::concat);
    private static final Monoid<Integer> INT_SUM = Monoid.of(0, Integer::sum);
    private static final Monoid<Integer> INT_PRODUCT = Monoid.of(1, (a, b) -> a * b);

    private Monoids() {}

    public static Monoid<String> stringConcat() {
        return STRING_CONCAT;
    }

    public static Monoid<Integer> intSum() {
        return INT_SUM;
    }

    public static Monoid<Integer> intProduct() {
        return INT_PRODUCT;
    }

    /**
     * List concatenation. The result is always a fresh unmodifiable list.
     */
    public static <A> Monoid<List<A>> list() {
        return Monoid.lazy(List::of, (first, second) -> {
            List<A> all = new ArrayList<>(first.size() + second.size());
            all.addAll(first);
            all.addAll(second);
            return Collections.unmodifiableList(all);
        });
    }
}
