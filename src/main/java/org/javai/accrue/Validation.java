package org.javai.accrue;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The result of a validation: either {@link Success} holding the validated value, or
 * {@link Failure} holding every {@link ValidationError} that was found.
 *
 * <p>Unlike a fail-fast result type, validations combined applicatively
 * ({@link #monadAp}) accumulate the errors of both sides. Dependent sequencing
 * ({@link #chain}) still short-circuits: a step that needs the previous value cannot
 * run without it.
 *
 * <p>No operation throws on a failed validation; failures are values. Only
 * {@link #getOrThrow()} raises, and only when explicitly asked to.
 *
 * @param <A> The type of the validated value
 */
public sealed interface Validation<A> permits Validation.Success, Validation.Failure {

    /**
     * A successful validation.
     *
     * @param value the validated value (may be null)
     */
    record Success<A>(A value) implements Validation<A> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Errors errors() {
            return Errors.empty();
        }

        @Override
        public A getOrThrow() {
            return value;
        }

        @Override
        public A getOrElse(A defaultValue) {
            return value;
        }

        @Override
        public A getOrElseGet(Function<? super Errors, ? extends A> supplier) {
            return value;
        }

        @Override
        public <B> B fold(Function<? super Errors, ? extends B> onFailure, Function<? super A, ? extends B> onSuccess) {
            Objects.requireNonNull(onSuccess);
            return onSuccess.apply(value);
        }

        @Override
        public <B> Validation<B> map(Function<? super A, ? extends B> mapper) {
            Objects.requireNonNull(mapper);
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <B> Validation<B> chain(Function<? super A, ? extends Validation<B>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Validation<A> chainLeft(Function<? super Errors, ? extends Validation<A>> handler) {
            return this;
        }

        @Override
        public Validation<A> mapErrors(Function<? super Errors, Errors> mapper) {
            return this;
        }

        @Override
        public Result<A> toResult() {
            return Result.ok(value);
        }
    }

    /**
     * A failed validation.
     *
     * @param errors every error found, never empty
     */
    record Failure<A>(Errors errors) implements Validation<A> {

        public Failure {
            Objects.requireNonNull(errors, "errors must not be null");
            if (errors.isEmpty()) {
                throw new IllegalArgumentException("a failure needs at least one error");
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public A getOrThrow() {
            throw ValidationErrorsException.of(errors);
        }

        @Override
        public A getOrElse(A defaultValue) {
            return defaultValue;
        }

        @Override
        public A getOrElseGet(Function<? super Errors, ? extends A> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.apply(errors);
        }

        @Override
        public <B> B fold(Function<? super Errors, ? extends B> onFailure, Function<? super A, ? extends B> onSuccess) {
            Objects.requireNonNull(onFailure);
            return onFailure.apply(errors);
        }

        @Override
        public <B> Validation<B> map(Function<? super A, ? extends B> mapper) {
            return new Failure<>(errors);
        }

        @Override
        public <B> Validation<B> chain(Function<? super A, ? extends Validation<B>> mapper) {
            return new Failure<>(errors);
        }

        @Override
        public Validation<A> chainLeft(Function<? super Errors, ? extends Validation<A>> handler) {
            Objects.requireNonNull(handler);
            Validation<A> recovered = handler.apply(errors);
            if (recovered instanceof Failure<A> failed) {
                // a failed recovery keeps what it tried to recover from
                return new Failure<>(errors.concat(failed.errors()));
            }
            return recovered;
        }

        @Override
        public Validation<A> mapErrors(Function<? super Errors, Errors> mapper) {
            Objects.requireNonNull(mapper);
            return failures(mapper.apply(errors));
        }

        @Override
        public Result<A> toResult() {
            return Result.err(ValidationErrorsException.of(errors));
        }
    }

    // Query methods
    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The accumulated errors; empty for a success.
     */
    Errors errors();

    // Value extraction
    A getOrThrow();
    A getOrElse(A defaultValue);
    A getOrElseGet(Function<? super Errors, ? extends A> supplier);

    <B> B fold(Function<? super Errors, ? extends B> onFailure, Function<? super A, ? extends B> onSuccess);

    // Functor / monad
    <B> Validation<B> map(Function<? super A, ? extends B> mapper);
    <B> Validation<B> chain(Function<? super A, ? extends Validation<B>> mapper);

    // Failure channel

    /**
     * Operates on the failure channel. A success passes through and the handler is not
     * called. On failure the handler's success replaces the failure; the handler's failure
     * is appended to the original errors.
     */
    Validation<A> chainLeft(Function<? super Errors, ? extends Validation<A>> handler);

    /**
     * Same as {@link #chainLeft}.
     */
    default Validation<A> orElse(Function<? super Errors, ? extends Validation<A>> handler) {
        return chainLeft(handler);
    }

    /**
     * Returns this validation if it succeeded, otherwise the second one. The supplier is
     * called only when this validation failed. When both fail the errors of both are kept,
     * this validation's first.
     */
    default Validation<A> alt(Supplier<? extends Validation<A>> second) {
        Objects.requireNonNull(second, "second must not be null");
        return chainLeft(ignored -> second.get());
    }

    /**
     * Rewrites the errors of a failure; a success is unchanged. The mapper must not
     * return an empty sequence.
     */
    Validation<A> mapErrors(Function<? super Errors, Errors> mapper);

    /**
     * Collapses the errors into a single {@link ValidationErrorsException}.
     */
    Result<A> toResult();

    // Static factories
    static <A> Validation<A> of(A value) {
        return new Success<>(value);
    }

    static <A> Validation<A> success(A value) {
        return new Success<>(value);
    }

    static <A> Validation<A> failures(Errors errors) {
        return new Failure<>(errors);
    }

    static <A> Validation<A> failure(ValidationError error) {
        return new Failure<>(Errors.of(error));
    }

    /**
     * Creates a failure that records {@code value} and {@code message} at whatever
     * context the returned reader is applied to.
     *
     * <pre>{@code
     * Reader<Context, Validation<Integer>> fail = Validation.failureWithMessage("abc", "expected integer");
     * fail.apply(Context.of(ContextEntry.of("age", "int")));
     * }</pre>
     */
    static <A> Reader<Context, Validation<A>> failureWithMessage(Object value, String message) {
        Objects.requireNonNull(message, "message must not be null");
        return context -> failure(new ValidationError(value, context, message, null));
    }

    /**
     * Like {@link #failureWithMessage} but also takes the exception that caused the failure.
     *
     * <pre>{@code
     * Validation.<Integer>failureWithError("abc", "parse failed").apply(e).apply(context);
     * }</pre>
     */
    static <A> Function<Throwable, Reader<Context, Validation<A>>> failureWithError(Object value, String message) {
        Objects.requireNonNull(message, "message must not be null");
        return cause -> context -> failure(new ValidationError(value, context, message, cause));
    }

    /**
     * Applies a validated function to a validated value. When both sides fail the errors
     * of both are kept, the function side's first.
     */
    static <A, B> Validation<B> monadAp(Validation<? extends Function<? super A, ? extends B>> fab, Validation<A> fa) {
        Objects.requireNonNull(fab, "fab must not be null");
        Objects.requireNonNull(fa, "fa must not be null");
        if (fab.isSuccess() && fa.isSuccess()) {
            Function<? super A, ? extends B> f = fab.getOrThrow();
            return new Success<>(f.apply(fa.getOrThrow()));
        }
        // on a one-sided failure the other side contributes no errors
        return new Failure<>(fab.errors().concat(fa.errors()));
    }
}
