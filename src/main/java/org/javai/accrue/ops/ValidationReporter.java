package org.javai.accrue.ops;

import org.javai.accrue.Errors;

/**
 * Reports failed validations for observability.
 * Implementations might emit metrics, structured logs, or alerts.
 */
@FunctionalInterface
public interface ValidationReporter {

    /**
     * Reports that an operation rejected its input.
     *
     * @param operation The operation that ran the validation
     * @param errors Every error the validation produced, never empty
     */
    void report(String operation, Errors errors);

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static ValidationReporter noOp() {
        return (operation, errors) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static ValidationReporter composite(ValidationReporter... reporters) {
        return CompositeValidationReporter.of(reporters);
    }
}
