package org.javai.retrrry.policy;

import org.javai.retrrry.Outcome;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.*;

class RejectionPolicyTest {

    @Test
    void defaults_rejectsEveryFailure() {
        RejectionPolicy policy = RejectionPolicy.defaults();

        assertThat(policy.shouldReject(Outcome.fail(1, new IOException()))).isTrue();
        assertThat(policy.shouldReject(Outcome.fail(1, new OutOfMemoryError()))).isTrue();
    }

    @Test
    void defaults_acceptsEveryValue() {
        RejectionPolicy policy = RejectionPolicy.defaults();

        assertThat(policy.shouldReject(Outcome.ok(1, null))).isFalse();
        assertThat(policy.shouldReject(Outcome.ok(1, "value"))).isFalse();
    }

    @Test
    void of_nullPredicates_fallBackToDefaults() {
        RejectionPolicy policy = RejectionPolicy.of(null, null);

        assertThat(policy.shouldReject(Outcome.fail(1, new IOException()))).isTrue();
        assertThat(policy.shouldReject(Outcome.ok(1, null))).isFalse();
    }

    @Test
    void of_resultPredicate_judgesOnlyValues() {
        RejectionPolicy policy = RejectionPolicy.of(t -> false, Objects::isNull);

        assertThat(policy.shouldReject(Outcome.ok(2, null))).isTrue();
        assertThat(policy.shouldReject(Outcome.ok(2, 0))).isFalse();
        assertThat(policy.shouldReject(Outcome.fail(2, new IOException()))).isFalse();
    }

    @Test
    void of_exceptionPredicate_receivesOriginalThrowable() {
        IOException error = new IOException("disk");
        RejectionPolicy policy = RejectionPolicy.of(t -> t == error, null);

        assertThat(policy.shouldReject(Outcome.fail(1, error))).isTrue();
        assertThat(policy.shouldReject(Outcome.fail(1, new IOException("disk")))).isFalse();
    }

    @Test
    void retryIfExceptionOfType_matchesSubtypes() {
        Predicate<Throwable> predicate = RejectionPolicy.retryIfExceptionOfType(
                List.of(IOException.class, TimeoutException.class));

        assertThat(predicate.test(new IOException())).isTrue();
        assertThat(predicate.test(new FileNotFoundException())).isTrue();
        assertThat(predicate.test(new TimeoutException())).isTrue();
        assertThat(predicate.test(new IllegalStateException())).isFalse();
    }

    @Test
    void retryIfExceptionOfType_empty_matchesNothing() {
        assertThat(RejectionPolicy.retryIfExceptionOfType(List.of()).test(new IOException())).isFalse();
    }

    @Test
    void shouldReject_null_isRejected() {
        assertThatThrownBy(() -> RejectionPolicy.defaults().shouldReject(null))
                .isInstanceOf(NullPointerException.class);
    }
}
