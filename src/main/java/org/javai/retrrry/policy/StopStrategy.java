package org.javai.retrrry.policy;

import org.javai.retrrry.RetryConfig;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The built-in stop policies, selectable by name.
 *
 * <p>Names follow the legacy method names ({@code stop_after_attempt}); the enum constant
 * names are accepted as well. Selecting a strategy bypasses composition: only the named
 * policy applies, bound to the configured or default parameters.
 */
public enum StopStrategy {

    STOP_AFTER_ATTEMPT("stop_after_attempt") {
        @Override
        public StopPolicy create(RetryConfig config) {
            return StopPolicy.afterAttempt(config.effectiveStopMaxAttemptNumber());
        }
    },

    STOP_AFTER_DELAY("stop_after_delay") {
        @Override
        public StopPolicy create(RetryConfig config) {
            return StopPolicy.afterDelay(config.effectiveStopMaxDelay());
        }
    };

    private final String methodName;

    StopStrategy(String methodName) {
        this.methodName = methodName;
    }

    public String methodName() {
        return methodName;
    }

    /**
     * Binds this strategy to the parameters of the given configuration.
     */
    public abstract StopPolicy create(RetryConfig config);

    /**
     * Resolves a strategy by its method name or constant name.
     *
     * @throws IllegalArgumentException if the name matches no strategy
     */
    public static StopStrategy fromName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        for (StopStrategy strategy : values()) {
            if (strategy.methodName.equals(name) || strategy.name().equalsIgnoreCase(name)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown stop strategy '" + name + "', expected one of: "
                + Arrays.stream(values()).map(StopStrategy::methodName).collect(Collectors.joining(", ")));
    }
}
