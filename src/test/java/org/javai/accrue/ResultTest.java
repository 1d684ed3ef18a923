package org.javai.accrue;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class ResultTest {

    @Test
    void ok_containsValue() {
        Result<String> result = Result.ok("hello");

        assertThat(result.isOk()).isTrue();
        assertThat(result.getOrThrow()).isEqualTo("hello");
        assertThat(result.error().isNone()).isTrue();
    }

    @Test
    void err_getOrThrow_rethrowsRuntimeException() {
        IllegalStateException cause = new IllegalStateException("bad state");

        assertThatThrownBy(() -> Result.err(cause).getOrThrow()).isSameAs(cause);
    }

    @Test
    void err_getOrThrow_wrapsCheckedException() {
        IOException cause = new IOException("disk");

        assertThatThrownBy(() -> Result.err(cause).getOrThrow())
                .isInstanceOf(ResultFailedException.class)
                .hasMessage("Result failed: disk")
                .hasCause(cause);
    }

    @Test
    void map_and_chain_skipErr() {
        Result<Integer> err = Result.err(new IOException("x"));

        assertThat(err.map(x -> x + 1).isErr()).isTrue();
        assertThat(Result.ok(1).chain(x -> Result.ok(x + 1))).isEqualTo(Result.ok(2));
    }

    @Test
    void recover_and_mapErr() {
        Result<Integer> err = Result.err(new IOException("x"));

        assertThat(err.recover(e -> -1).getOrThrow()).isEqualTo(-1);
        assertThat(err.mapErr(e -> new IllegalArgumentException("wrapped", e)).error().getOrElse(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void of_capturesRuntimeException() {
        Result<Integer> result = Result.of(() -> Integer.parseInt("abc"));

        assertThat(result.isErr()).isTrue();
        assertThat(result.error().getOrElse(null)).isInstanceOf(NumberFormatException.class);
    }
}
