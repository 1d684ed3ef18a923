package org.javai.accrue;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The outcome of a computation that yields a value or fails with a single error.
 * Either {@link Ok} containing the value, or {@link Err} containing the error.
 *
 * <p>This is the conventional single-error shape that {@link Validation} converts to and
 * from at its edges: {@link Validation#toResult()} collapses accumulated errors into one
 * {@link ValidationErrorsException}, and
 * {@link org.javai.accrue.validate.Validators#fromReaderResult} lifts an error-or-value
 * function into a validator.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    /**
     * A successful result.
     *
     * @param value the value (may be null)
     */
    record Ok<T>(T value) implements Result<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public Option<Throwable> error() {
            return Option.none();
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> chain(Function<? super T, ? extends Result<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Result<T> mapErr(Function<? super Throwable, ? extends Throwable> mapper) {
            return this;
        }

        @Override
        public Result<T> recover(Function<? super Throwable, ? extends T> recovery) {
            return this;
        }

        @Override
        public <U> U fold(Function<? super Throwable, ? extends U> onErr, Function<? super T, ? extends U> onOk) {
            return onOk.apply(value);
        }
    }

    /**
     * A failed result.
     *
     * @param cause the error, never null
     */
    record Err<T>(Throwable cause) implements Result<T> {

        public Err {
            Objects.requireNonNull(cause, "cause must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ResultFailedException(cause);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public Option<Throwable> error() {
            return Option.some(cause);
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Err<>(cause);
        }

        @Override
        public <U> Result<U> chain(Function<? super T, ? extends Result<U>> mapper) {
            return new Err<>(cause);
        }

        @Override
        public Result<T> mapErr(Function<? super Throwable, ? extends Throwable> mapper) {
            Objects.requireNonNull(mapper);
            return new Err<>(mapper.apply(cause));
        }

        @Override
        public Result<T> recover(Function<? super Throwable, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(cause));
        }

        @Override
        public <U> U fold(Function<? super Throwable, ? extends U> onErr, Function<? super T, ? extends U> onOk) {
            return onErr.apply(cause);
        }
    }

    // Query methods
    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    Option<Throwable> error();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);

    // Transformations
    <U> Result<U> map(Function<? super T, ? extends U> mapper);
    <U> Result<U> chain(Function<? super T, ? extends Result<U>> mapper);
    Result<T> mapErr(Function<? super Throwable, ? extends Throwable> mapper);

    // Recovery
    Result<T> recover(Function<? super Throwable, ? extends T> recovery);

    <U> U fold(Function<? super Throwable, ? extends U> onErr, Function<? super T, ? extends U> onOk);

    // Static factories
    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(Throwable cause) {
        return new Err<>(cause);
    }

    /**
     * Runs the supplier, capturing any runtime exception as an {@link Err}.
     */
    static <T> Result<T> of(Supplier<? extends T> work) {
        Objects.requireNonNull(work, "work must not be null");
        try {
            return ok(work.get());
        } catch (RuntimeException e) {
            return err(e);
        }
    }
}
