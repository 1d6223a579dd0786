package org.javai.retrrry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryingTest {

    @Test
    void wrap_defaults_retriesUntilSuccess() throws IOException {
        AtomicInteger attempts = new AtomicInteger();
        ThrowingSupplier<String, IOException> read = Retrying.wrap(() -> {
            if (attempts.incrementAndGet() < 4) {
                throw new IOException("not yet");
            }
            return "content";
        });

        assertThat(read.get()).isEqualTo("content");
        assertThat(attempts).hasValue(4);
    }

    @Test
    void wrap_eachInvocationRunsFreshLoop() throws IOException {
        AtomicInteger attempts = new AtomicInteger();
        Retrier retrier = Retrier.builder().stopMaxAttemptNumber(2).build();
        ThrowingSupplier<Integer, IOException> work = Retrying.wrap(retrier, () -> {
            if (attempts.incrementAndGet() % 2 == 1) {
                throw new IOException("odd attempt");
            }
            return attempts.get();
        });

        assertThat(work.get()).isEqualTo(2);
        assertThat(work.get()).isEqualTo(4);
    }

    @Test
    void wrap_givesUp_rethrowsDeclaredException() {
        Retrier retrier = Retrier.builder().stopMaxAttemptNumber(2).build();
        ThrowingSupplier<String, IOException> work = Retrying.wrap(retrier, () -> {
            throw new IOException("always");
        });

        assertThatThrownBy(work::get).isInstanceOf(IOException.class).hasMessage("always");
    }

    @Test
    void wrapFunction_passesArgumentThrough() {
        List<Long> seen = new ArrayList<>();
        Retrier retrier = Retrier.builder().retryOnResult(Objects::isNull).build();
        ThrowingFunction<Long, String, RuntimeException> fetch = Retrying.wrapFunction(retrier, id -> {
            seen.add(id);
            return seen.size() < 3 ? null : "user-" + id;
        });

        assertThat(fetch.apply(42L)).isEqualTo("user-42");
        assertThat(seen).containsExactly(42L, 42L, 42L);
    }

    @Test
    void wrapFunction_defaults_returnsImmediatelyOnSuccess() {
        ThrowingFunction<String, Integer, RuntimeException> length = Retrying.wrapFunction(String::length);

        assertThat(length.apply("abc")).isEqualTo(3);
    }

    @Test
    void wrap_fixedWait_actuallySleepsBetweenAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        Retrier retrier = Retrier.builder().waitFixed(50).retryOnResult(Objects::isNull).build();
        ThrowingSupplier<Object, RuntimeException> work = Retrying.wrap(retrier,
                () -> attempts.incrementAndGet() <= 5 ? null : true);

        long start = System.nanoTime();
        Object result = work.get();
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertThat(result).isEqualTo(true);
        assertThat(attempts).hasValue(6);
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(250);
    }

    @Test
    void wrap_nullArguments_areRejected() {
        assertThatThrownBy(() -> Retrying.wrap(null, () -> "x")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Retrying.wrapFunction(Retrier.defaults(), null)).isInstanceOf(NullPointerException.class);
    }
}
