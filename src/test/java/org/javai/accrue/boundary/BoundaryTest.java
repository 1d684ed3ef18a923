package org.javai.accrue.boundary;

import org.javai.accrue.Errors;
import org.javai.accrue.Result;
import org.javai.accrue.Validation;
import org.javai.accrue.ValidationError;
import org.javai.accrue.ValidationErrorsException;
import org.javai.accrue.validate.Validate;
import org.javai.accrue.validate.Validators;
import org.javai.accrue.ops.ValidationReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BoundaryTest {

    private Boundary boundary;
    private List<String> reportedOperations;
    private List<Errors> reportedErrors;

    @BeforeEach
    void setUp() {
        reportedOperations = new ArrayList<>();
        reportedErrors = new ArrayList<>();
        ValidationReporter reporter = (operation, errors) -> {
            reportedOperations.add(operation);
            reportedErrors.add(errors);
        };
        boundary = Boundary.withReporter(reporter);
    }

    @Test
    void validator_success_returnsValue() {
        Validate<String, URI> uri = boundary.validator(URI::new);

        assertThat(uri.validate("https://example.com").getOrThrow()).isEqualTo(URI.create("https://example.com"));
    }

    @Test
    void validator_checkedException_becomesDecodeError() {
        Validate<String, URI> uri = boundary.<String, URI>validator(URI::new).at("endpoint", "URI");

        Validation<URI> result = uri.validate("not a uri");

        ValidationError error = result.errors().get(0);
        assertThat(error.message()).isEqualTo(Validators.UNABLE_TO_DECODE);
        assertThat(error.value()).isEqualTo("not a uri");
        assertThat(error.context().path()).isEqualTo("endpoint");
        assertThat(error.cause()).isInstanceOf(URISyntaxException.class);
    }

    @Test
    void validator_runtimeException_propagates() {
        Validate<String, Integer> parse = boundary.validator(Integer::parseInt);

        assertThatThrownBy(() -> parse.validate("abc"))
                .isInstanceOf(NumberFormatException.class);
        assertThat(reportedOperations).isEmpty();
    }

    @Test
    void run_success_returnsOkWithoutReporting() {
        Result<URI> result = boundary.run("config.endpoint", boundary.validator(URI::new), "https://example.com");

        assertThat(result.isOk()).isTrue();
        assertThat(reportedOperations).isEmpty();
    }

    @Test
    void run_failure_reportsAndCollapsesErrors() {
        Validate<String, String> twoChecks = Validators.<String>fromPredicate(s -> s.length() > 3, s -> "too short")
                .chainLeft(errors -> Validators.failure("no fallback"));

        Result<String> result = boundary.run("signup", twoChecks, "ab");

        assertThat(result.isErr()).isTrue();
        assertThat(result.error().getOrElse(null))
                .isInstanceOf(ValidationErrorsException.class)
                .hasMessage("ValidationErrors: 2 errors");
        assertThat(reportedOperations).containsExactly("signup");
        assertThat(reportedErrors.get(0).messages()).containsExactly("too short", "no fallback");
    }

    @Test
    void validate_failure_reportsAndReturnsValidation() {
        Validation<Integer> result = boundary.validate("age", Validators.failure("missing"), "");

        assertThat(result.isFailure()).isTrue();
        assertThat(reportedOperations).containsExactly("age");
    }

    @Test
    void silent_neverReports() {
        Boundary silent = Boundary.silent();

        Result<Integer> result = silent.run("age", Validators.failure("missing"), "");

        assertThat(result.isErr()).isTrue();
        assertThat(reportedOperations).isEmpty();
    }

    @Test
    void constructor_rejectsNullReporter() {
        assertThatThrownBy(() -> new Boundary(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("reporter must not be null");
    }
}
