package org.javai.accrue;

import org.junit.jupiter.api.Test;

import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

class OptionTest {

    @Test
    void some_canHoldNull() {
        Option<String> present = Option.some(null);

        assertThat(present.isSome()).isTrue();
        assertThat(present.getOrElse("fallback")).isNull();
        assertThat(present.toOptional()).isEmpty();
    }

    @Test
    void ofNullable_mapsNullToNone() {
        assertThat(Option.ofNullable(null).isNone()).isTrue();
        assertThat(Option.ofNullable("x")).isEqualTo(Option.some("x"));
    }

    @Test
    void map_nullResult_becomesNone() {
        assertThat(Option.some("x").map(s -> null).isNone()).isTrue();
    }

    @Test
    void chain_and_filter() {
        Option<Integer> five = Option.some(5);

        assertThat(five.chain(x -> x > 3 ? Option.some(x * 2) : Option.none())).isEqualTo(Option.some(10));
        assertThat(five.filter(x -> x % 2 == 0).isNone()).isTrue();
        assertThat(Option.<Integer>none().chain(x -> Option.some(x))).isEqualTo(Option.none());
    }

    @Test
    void orElse_isLazy() {
        assertThat(Option.some(1).orElse(() -> {
            throw new AssertionError("must not be evaluated");
        })).isEqualTo(Option.some(1));
        assertThat(Option.<Integer>none().orElse(() -> Option.some(2))).isEqualTo(Option.some(2));
    }

    @Test
    void fromPredicate_rejectsNullAndNonMatching() {
        Function<Integer, Option<Integer>> positive = Option.fromPredicate(x -> x > 0);

        assertThat(positive.apply(3)).isEqualTo(Option.some(3));
        assertThat(positive.apply(-3).isNone()).isTrue();
        assertThat(positive.apply(null).isNone()).isTrue();
    }

    @Test
    void toOptional_bridgesToJdk() {
        assertThat(Option.some("a").toOptional()).contains("a");
        assertThat(Option.none().toOptional()).isEmpty();
    }
}
