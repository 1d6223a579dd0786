package org.javai.retrrry;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class RetryExceptionTest {

    @Test
    void wrapsProducedValue_withoutCause() {
        Outcome<String> last = Outcome.ok(3, null);

        RetryException exception = new RetryException(last);

        assertThat(exception.lastAttempt()).isSameAs(last);
        assertThat(exception.attemptNumber()).isEqualTo(3);
        assertThat(exception.getCause()).isNull();
        assertThat(exception.getMessage()).isEqualTo("RetryError[Attempts: 3, Value: null]");
    }

    @Test
    void wrapsFailure_withOriginalAsCause() {
        IOException error = new IOException("disk error");
        Outcome<String> last = Outcome.fail(2, error);

        RetryException exception = new RetryException(last);

        assertThat(exception.getCause()).isSameAs(error);
        assertThat(exception.getMessage()).startsWith("RetryError[Attempts: 2, Error:\njava.io.IOException: disk error");
    }

    @Test
    void requiresLastAttempt() {
        assertThatThrownBy(() -> new RetryException(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("lastAttempt");
    }
}
