package org.javai.accrue;

import java.util.Objects;

/**
 * A single exception standing for a whole {@link Errors} sequence.
 *
 * <p>Used only at the edge, where validation results meet code that expects one error
 * value: {@link Validation#toResult()} and {@link Validation#getOrThrow()}. This is an
 * unchecked exception because reaching it through {@code getOrThrow} indicates misuse;
 * the caller should have folded over the validation instead.
 */
public class ValidationErrorsException extends RuntimeException {

    private final Errors errors;

    public ValidationErrorsException(Errors errors) {
        this(errors, null);
    }

    public ValidationErrorsException(Errors errors, Throwable rootCause) {
        super(summary(Objects.requireNonNull(errors, "errors must not be null")), rootCause);
        this.errors = errors;
    }

    public static ValidationErrorsException of(Errors errors) {
        return new ValidationErrorsException(errors);
    }

    public static ValidationErrorsException of(Errors errors, Throwable rootCause) {
        return new ValidationErrorsException(errors, rootCause);
    }

    public Errors errors() {
        return errors;
    }

    /**
     * Lists every error with its index, followed by the root cause when present.
     */
    public String describe() {
        if (errors.isEmpty()) {
            return summary(errors);
        }
        StringBuilder sb = new StringBuilder("ValidationErrors (").append(errors.size()).append("):\n");
        for (int i = 0; i < errors.size(); i++) {
            sb.append("  [").append(i).append("] ").append(errors.get(i)).append('\n');
        }
        if (getCause() != null) {
            sb.append("  root cause: ").append(getCause()).append('\n');
        }
        return sb.toString();
    }

    private static String summary(Errors errors) {
        return switch (errors.size()) {
            case 0 -> "ValidationErrors: no errors";
            case 1 -> "ValidationErrors: 1 error";
            default -> "ValidationErrors: " + errors.size() + " errors";
        };
    }
}
