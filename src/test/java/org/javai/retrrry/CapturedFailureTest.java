package org.javai.retrrry;

import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.lang.reflect.UndeclaredThrowableException;

import static org.assertj.core.api.Assertions.*;

class CapturedFailureTest {

    @Test
    void capture_snapshotsTypeMessageAndTrace() {
        IOException error = new IOException("disk error");

        CapturedFailure failure = CapturedFailure.capture(error);

        assertThat(failure.exception()).isSameAs(error);
        assertThat(failure.type()).isEqualTo("java.io.IOException");
        assertThat(failure.message()).isEqualTo("disk error");
        assertThat(failure.trace()).containsExactly(error.getStackTrace());
        assertThat(failure.occurredAt()).isNotNull();
    }

    @Test
    void capture_traceIsNotAffectedByLaterChanges() {
        IOException error = new IOException("disk error");
        CapturedFailure failure = CapturedFailure.capture(error);
        int frames = failure.trace().size();

        error.setStackTrace(new StackTraceElement[0]);

        assertThat(failure.trace()).hasSize(frames);
        assertThatThrownBy(() -> failure.trace().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void capture_fingerprintUsesTopFrame() {
        IOException error = new IOException("x");
        StackTraceElement top = error.getStackTrace()[0];

        CapturedFailure failure = CapturedFailure.capture(error);

        assertThat(failure.fingerprint())
                .isEqualTo("IOException@" + top.getClassName() + ":" + top.getLineNumber());
    }

    @Test
    void capture_withoutStackTrace_fingerprintIsClassName() {
        IOException error = new IOException("x");
        error.setStackTrace(new StackTraceElement[0]);

        assertThat(CapturedFailure.capture(error).fingerprint()).isEqualTo("java.io.IOException");
    }

    @Test
    void isInstanceOf_matchesSupertypes() {
        CapturedFailure failure = CapturedFailure.capture(new FileNotFoundException("missing"));

        assertThat(failure.isInstanceOf(FileNotFoundException.class)).isTrue();
        assertThat(failure.isInstanceOf(IOException.class)).isTrue();
        assertThat(failure.isInstanceOf(RuntimeException.class)).isFalse();
    }

    @Test
    void rethrow_rethrowsCheckedExceptionUnchanged() {
        IOException error = new IOException("disk error");

        assertThatThrownBy(() -> CapturedFailure.capture(error).rethrow()).isSameAs(error);
    }

    @Test
    void rethrow_rethrowsError() {
        AssertionError error = new AssertionError("bad");

        assertThatThrownBy(() -> CapturedFailure.capture(error).rethrow()).isSameAs(error);
    }

    @Test
    void rethrow_wrapsPlainThrowable() {
        Throwable odd = new Throwable("neither exception nor error");

        assertThatThrownBy(() -> CapturedFailure.capture(odd).rethrow())
                .isInstanceOf(UndeclaredThrowableException.class)
                .hasCause(odd);
    }

    @Test
    void formattedTrace_startsWithTypeAndMessage() {
        CapturedFailure failure = CapturedFailure.capture(new IllegalStateException("boom"));

        assertThat(failure.formattedTrace())
                .startsWith("java.lang.IllegalStateException: boom\n\tat ");
    }

    @Test
    void formattedTrace_withoutMessage_omitsSeparator() {
        IllegalStateException error = new IllegalStateException();
        error.setStackTrace(new StackTraceElement[0]);

        assertThat(CapturedFailure.capture(error).formattedTrace()).isEqualTo("java.lang.IllegalStateException");
    }
}
