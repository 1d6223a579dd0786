package org.javai.retrrry.policy;

import org.javai.retrrry.RetryConfig;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The built-in wait policies, selectable by name ({@code fixed_sleep}, {@code random_sleep},
 * {@code incrementing_sleep}, {@code exponential_sleep}).
 */
public enum WaitStrategy {

    FIXED_SLEEP("fixed_sleep") {
        @Override
        public WaitPolicy create(RetryConfig config) {
            return WaitPolicy.fixed(config.effectiveWaitFixed());
        }
    },

    RANDOM_SLEEP("random_sleep") {
        @Override
        public WaitPolicy create(RetryConfig config) {
            return WaitPolicy.random(config.effectiveWaitRandomMin(), config.effectiveWaitRandomMax());
        }
    },

    INCREMENTING_SLEEP("incrementing_sleep") {
        @Override
        public WaitPolicy create(RetryConfig config) {
            return WaitPolicy.incrementing(
                    config.effectiveWaitIncrementingStart(),
                    config.effectiveWaitIncrementingIncrement(),
                    config.effectiveWaitIncrementingMax());
        }
    },

    EXPONENTIAL_SLEEP("exponential_sleep") {
        @Override
        public WaitPolicy create(RetryConfig config) {
            return WaitPolicy.exponential(
                    config.effectiveWaitExponentialMultiplier(),
                    config.effectiveWaitExponentialMax());
        }
    };

    private final String methodName;

    WaitStrategy(String methodName) {
        this.methodName = methodName;
    }

    public String methodName() {
        return methodName;
    }

    public abstract WaitPolicy create(RetryConfig config);

    /**
     * @throws IllegalArgumentException if the name matches no strategy
     */
    public static WaitStrategy fromName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        for (WaitStrategy strategy : values()) {
            if (strategy.methodName.equals(name) || strategy.name().equalsIgnoreCase(name)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown wait strategy '" + name + "', expected one of: "
                + Arrays.stream(values()).map(WaitStrategy::methodName).collect(Collectors.joining(", ")));
    }
}
