package org.javai.retrrry.policy;

import org.javai.retrrry.Retrier;
import org.javai.retrrry.RetryConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class StrategyNameTest {

    @ParameterizedTest
    @CsvSource({
            "stop_after_attempt, STOP_AFTER_ATTEMPT",
            "STOP_AFTER_ATTEMPT, STOP_AFTER_ATTEMPT",
            "stop_after_delay, STOP_AFTER_DELAY",
            "Stop_After_Delay, STOP_AFTER_DELAY"
    })
    void stopStrategy_fromName_acceptsMethodAndConstantNames(String name, StopStrategy expected) {
        assertThat(StopStrategy.fromName(name)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "fixed_sleep, FIXED_SLEEP",
            "random_sleep, RANDOM_SLEEP",
            "incrementing_sleep, INCREMENTING_SLEEP",
            "exponential_sleep, EXPONENTIAL_SLEEP",
            "EXPONENTIAL_SLEEP, EXPONENTIAL_SLEEP"
    })
    void waitStrategy_fromName_acceptsMethodAndConstantNames(String name, WaitStrategy expected) {
        assertThat(WaitStrategy.fromName(name)).isEqualTo(expected);
    }

    @Test
    void fromName_unknown_listsValidNames() {
        assertThatThrownBy(() -> StopStrategy.fromName("stop_never"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown stop strategy 'stop_never', expected one of: stop_after_attempt, stop_after_delay");
        assertThatThrownBy(() -> WaitStrategy.fromName("no_sleep"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fixed_sleep, random_sleep, incrementing_sleep, exponential_sleep");
    }

    @Test
    void create_unconfigured_usesDefaults() {
        RetryConfig config = Retrier.builder().build().config();

        assertThat(StopStrategy.STOP_AFTER_ATTEMPT.create(config).shouldStop(5, 0)).isTrue();
        assertThat(StopStrategy.STOP_AFTER_ATTEMPT.create(config).shouldStop(4, 0)).isFalse();
        assertThat(StopStrategy.STOP_AFTER_DELAY.create(config).shouldStop(1, 100)).isTrue();
        assertThat(WaitStrategy.FIXED_SLEEP.create(config).computeWaitMillis(3, 0)).isEqualTo(1000);
        assertThat(WaitStrategy.RANDOM_SLEEP.create(config).computeWaitMillis(3, 0)).isBetween(0L, 1000L);
        assertThat(WaitStrategy.INCREMENTING_SLEEP.create(config).computeWaitMillis(3, 0)).isEqualTo(200);
        assertThat(WaitStrategy.EXPONENTIAL_SLEEP.create(config).computeWaitMillis(3, 0)).isEqualTo(8);
    }
}
