package org.javai.accrue.validate;

import org.javai.accrue.Validation;
import org.javai.accrue.ValidationError;
import org.javai.accrue.optics.Lens;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

class DoNotationTest {

    record State(Integer x, Integer y) {
        static final State EMPTY = new State(null, null);
    }

    private static final Function<Integer, Function<State, State>> SET_X = x -> s -> new State(x, s.y());
    private static final Function<Integer, Function<State, State>> SET_Y = y -> s -> new State(s.x(), y);

    private static final Lens<State, Integer> X = Lens.of(State::x, (s, x) -> new State(x, s.y()));
    private static final Lens<State, Integer> Y = Lens.of(State::y, (s, y) -> new State(s.x(), y));

    @Test
    void bind_buildsStateStepByStep() {
        Validate<String, State> v = Validators.<String, State>start(State.EMPTY)
                .bind(SET_X, s -> Validators.of(10))
                .bind(SET_Y, s -> Validators.of(s.x() * 2));

        assertThat(v.validate("input")).isEqualTo(Validation.of(new State(10, 20)));
    }

    @Test
    void bind_failingStep_reportsOnlyItsError() {
        Validate<String, State> v = Validators.<String, State>start(State.EMPTY)
                .bind(SET_X, s -> Validators.of(10))
                .bind(SET_Y, s -> Validators.failure("y failed"));

        Validation<State> result = v.validate("input");

        assertThat(result.errors().messages()).containsExactly("y failed");
        ValidationError error = result.errors().get(0);
        assertThat(error.context().path()).isEmpty();
        assertThat(error.value()).isEqualTo("input");
    }

    @Test
    void bind_afterFailure_doesNotRun() {
        AtomicBoolean ran = new AtomicBoolean();

        Validate<String, State> v = Validators.<String, State>start(State.EMPTY)
                .bind(SET_X, s -> Validators.failure("x failed"))
                .bind(SET_Y, s -> {
                    ran.set(true);
                    return Validators.of(1);
                });

        assertThat(v.validate("input").errors().messages()).containsExactly("x failed");
        assertThat(ran).isFalse();
    }

    @Test
    void apS_accumulatesStateErrorThenValueError() {
        Validate<String, State> v = Validators.<String, State>failure("state error")
                .apS(SET_X, Validators.failure("value error"));

        Validation<State> result = v.validate("input");

        assertThat(result.errors().size()).isEqualTo(2);
        assertThat(result.errors().messages()).containsExactly("state error", "value error");
    }

    @Test
    void apS_independentFields_allErrorsReported() {
        Validate<String, State> v = Validators.<String, State>start(State.EMPTY)
                .apS(SET_X, Validators.failure("x invalid"))
                .apS(SET_Y, Validators.failure("y invalid"));

        assertThat(v.validate("input").errors().messages()).containsExactly("x invalid", "y invalid");
    }

    @Test
    void bind_afterFailedApS_propagatesWithoutRunning() {
        AtomicBoolean ran = new AtomicBoolean();

        Validate<String, State> v = Validators.<String, State>start(State.EMPTY)
                .apS(SET_X, Validators.failure("x invalid"))
                .bind(SET_Y, s -> {
                    ran.set(true);
                    return Validators.failure("y invalid");
                });

        assertThat(v.validate("input").errors().messages()).containsExactly("x invalid");
        assertThat(ran).isFalse();
    }

    @Test
    void let_and_letTo_computeFieldsWithoutFailing() {
        Validate<String, State> v = Validators.<String, State>start(State.EMPTY)
                .letTo(SET_X, 3)
                .let(SET_Y, s -> s.x() + 1);

        assertThat(v.validate("input")).isEqualTo(Validation.of(new State(3, 4)));
    }

    @Test
    void bindTo_wrapsValueIntoState() {
        Validate<String, State> v = Validators.<String, Integer>of(5).bindTo(x -> new State(x, null));

        assertThat(v.validate("input").getOrThrow()).isEqualTo(new State(5, null));
    }

    @Test
    void lensVariants_readAndWriteThroughLens() {
        Validate<String, State> v = Validators.<String, State>start(new State(1, 1))
                .apSL(X, Validators.of(10))
                .bindL(Y, y -> Validators.of(y + 100))
                .letL(X, x -> x * 2)
                .letToL(Y, 7);

        assertThat(v.validate("input")).isEqualTo(Validation.of(new State(20, 7)));
    }

    @Test
    void apSL_failure_accumulates() {
        Validate<String, State> v = Validators.<String, State>start(State.EMPTY)
                .apSL(X, Validators.failure("x invalid"))
                .apSL(Y, Validators.failure("y invalid"));

        assertThat(v.validate("input").errors().messages()).containsExactly("x invalid", "y invalid");
    }

    @Test
    void curriedOperators_matchMethodChaining() {
        Validate<String, State> chained = Validators.<String, State>start(State.EMPTY)
                .bind(SET_X, s -> Validators.of(10))
                .apS(SET_Y, Validators.of(20));

        Validate<String, State> curried = Validators.<String, State, State, Integer>bind(SET_X, s -> Validators.of(10))
                .then(Validators.apS(SET_Y, Validators.of(20)))
                .apply(Validators.start(State.EMPTY));

        assertThat(curried.validate("input")).isEqualTo(chained.validate("input"));
    }

    @Test
    void curriedLensOperators_applyInOrder() {
        ValidateOperator<String, State, State> pipeline = Validators.<String, State, Integer>letToL(X, 1)
                .then(Validators.letL(X, x -> x + 1))
                .then(Validators.bindL(Y, y -> Validators.of(5)))
                .then(Validators.apSL(Y, Validators.of(6)));

        assertThat(pipeline.apply(Validators.start(State.EMPTY)).validate("input"))
                .isEqualTo(Validation.of(new State(2, 6)));
    }
}
