package org.javai.accrue;

import java.util.Objects;

/**
 * A single validation failure: what was rejected, where, and why.
 *
 * <p>Errors are never surfaced alone; they always travel inside an {@link Errors}
 * sequence, even when there is only one.
 *
 * @param value The offending input (may be null)
 * @param context The path to the offending input
 * @param message Human-readable description of the failure
 * @param cause The underlying exception, if the failure wraps one (may be null)
 */
public record ValidationError(Object value, Context context, String message, Throwable cause) {

    public ValidationError {
        Objects.requireNonNull(message, "message must not be null");
        context = context == null ? Context.empty() : context;
    }

    /**
     * Creates an error at the root context without a cause.
     */
    public static ValidationError of(Object value, String message) {
        return new ValidationError(value, Context.empty(), message, null);
    }

    public static ValidationError of(Object value, Context context, String message) {
        return new ValidationError(value, context, message, null);
    }

    public Option<Throwable> causeOption() {
        return Option.ofNullable(cause);
    }

    /**
     * Follows the cause chain to its end. Returns {@link Option#none()} when this error
     * wraps no exception.
     */
    public Option<Throwable> rootCause() {
        if (cause == null) {
            return Option.none();
        }
        Throwable current = cause;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return Option.some(current);
    }

    /**
     * Returns a copy of this error relocated under the given context.
     */
    public ValidationError withContext(Context context) {
        return new ValidationError(value, context, message, cause);
    }

    /**
     * Verbose rendering: the compact form, the cause on its own line and the offending value.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(prefix()).append(message);
        if (cause != null) {
            sb.append("\n  caused by: ").append(cause);
        }
        sb.append("\n  value: ").append(value);
        return sb.toString();
    }

    /**
     * Compact rendering, e.g. {@code at user.email: invalid email format}.
     */
    @Override
    public String toString() {
        String result = prefix() + message;
        if (cause != null) {
            result += " (caused by: " + cause + ")";
        }
        return result;
    }

    private String prefix() {
        String path = context.path();
        return path.isEmpty() ? "" : "at " + path + ": ";
    }
}
