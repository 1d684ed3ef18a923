package org.javai.accrue;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class ValidationErrorTest {

    @Test
    void toString_includesPathAndMessage() {
        ValidationError error = ValidationError.of(
                "not-an-email",
                Context.empty().push("user", "User", null).push("email", "string", "not-an-email"),
                "invalid email format");

        assertThat(error).hasToString("at user.email: invalid email format");
    }

    @Test
    void toString_atRoot_isJustMessage() {
        assertThat(ValidationError.of(1, "too small")).hasToString("too small");
    }

    @Test
    void toString_withCause_appendsCause() {
        ValidationError error = new ValidationError("x", null, "unable to decode", new IOException("eof"));

        assertThat(error.toString()).isEqualTo("unable to decode (caused by: java.io.IOException: eof)");
        assertThat(error.context()).isEqualTo(Context.empty());
    }

    @Test
    void describe_listsCauseAndValue() {
        ValidationError error = new ValidationError("abc", Context.empty().push("age", "int", "abc"),
                "expected integer", new NumberFormatException("bad"));

        assertThat(error.describe()).isEqualTo(
                "at age: expected integer\n  caused by: java.lang.NumberFormatException: bad\n  value: abc");
    }

    @Test
    void rootCause_followsChain() {
        IOException root = new IOException("disk");
        ValidationError error = new ValidationError(null, null, "failed", new IllegalStateException("wrapper", root));

        assertThat(error.rootCause().getOrElse(null)).isSameAs(root);
        assertThat(ValidationError.of(null, "plain").rootCause().isNone()).isTrue();
    }

    @Test
    void message_isRequired() {
        assertThatThrownBy(() -> ValidationError.of("x", null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("message must not be null");
    }

    @Test
    void validationErrorsException_describe_listsEveryError() {
        Errors errors = Errors.of(ValidationError.of(1, "first"), ValidationError.of(2, "second"));

        ValidationErrorsException e = ValidationErrorsException.of(errors);

        assertThat(e.getMessage()).isEqualTo("ValidationErrors: 2 errors");
        assertThat(e.describe()).isEqualTo("ValidationErrors (2):\n  [0] first\n  [1] second\n");
        assertThat(ValidationErrorsException.of(Errors.empty()).getMessage()).isEqualTo("ValidationErrors: no errors");
    }
}
