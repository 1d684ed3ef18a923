package org.javai.accrue.boundary;

import java.util.Objects;
import org.javai.accrue.Result;
import org.javai.accrue.Validation;
import org.javai.accrue.validate.Validate;
import org.javai.accrue.validate.Validators;
import org.javai.accrue.ops.ValidationReporter;

/**
 * The boundary adapter between validation and the code around it.
 *
 * <p>On the way in, {@link #validator} turns third-party parsers that throw checked
 * exceptions into validators: the exception becomes a validation error with message
 * {@value Validators#UNABLE_TO_DECODE}, located at the current context, with the exception
 * as cause. On the way out, {@link #run} executes a validator, reports a failure to the
 * configured {@link ValidationReporter}, and collapses the result into a {@link Result}.
 *
 * <p>RuntimeExceptions (defects) are not caught. They propagate to the caller.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Log4jValidationReporter());
 *
 * Validate<String, URI> uri = boundary.validator(URI::new);
 * Result<URI> endpoint = boundary.run("config.endpoint", uri.at("endpoint", "URI"), raw);
 * }</pre>
 */
public final class Boundary {

    private final ValidationReporter reporter;

    /**
     * Creates a silent Boundary that converts failures but does not report them.
     *
     * <p>Useful for testing, prototyping, or any code that only needs the validators.
     *
     * @return a Boundary with no reporting
     */
    public static Boundary silent() {
        return new Boundary(ValidationReporter.noOp());
    }

    /**
     * Creates a Boundary that reports every failed {@link #run} to the given reporter.
     *
     * @param reporter the reporter for failure notifications
     * @return a reporting Boundary
     */
    public static Boundary withReporter(ValidationReporter reporter) {
        return new Boundary(reporter);
    }

    public Boundary(ValidationReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Lifts a function that may throw a checked exception into a validator.
     *
     * @param decoder The function to lift
     * @return a validator that succeeds with the decoder's result
     */
    public <I, A> Validate<I, A> validator(ThrowingFunction<? super I, ? extends A, ? extends Exception> decoder) {
        Objects.requireNonNull(decoder, "decoder must not be null");
        return input -> context -> {
            try {
                return Validation.of(decoder.apply(input));
            } catch (RuntimeException e) {
                // Defects propagate; they are not invalid input.
                throw e;
            } catch (Exception e) {
                return Validation.<A>failureWithError(input, Validators.UNABLE_TO_DECODE)
                        .apply(e)
                        .apply(context);
            }
        };
    }

    /**
     * Runs a validator from the root context, reporting a failure under {@code operation}.
     *
     * @param operation The operation name for reporting
     * @param validator The validator to run
     * @param input The input to validate
     * @return the validation as produced by the validator
     */
    public <I, A> Validation<A> validate(String operation, Validate<I, A> validator, I input) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(validator, "validator must not be null");

        Validation<A> result = validator.validate(input);
        if (result.isFailure()) {
            reporter.report(operation, result.errors());
        }
        return result;
    }

    /**
     * Like {@link #validate} but collapses a failure into a single
     * {@link org.javai.accrue.ValidationErrorsException}.
     *
     * @param operation The operation name for reporting
     * @param validator The validator to run
     * @param input The input to validate
     * @return Ok with the validated value, or Err holding every error
     */
    public <I, A> Result<A> run(String operation, Validate<I, A> validator, I input) {
        return validate(operation, validator, input).toResult();
    }
}
