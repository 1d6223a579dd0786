package org.javai.retrrry.config;

import org.javai.retrrry.Retrier;
import org.javai.retrrry.policy.RejectionPolicy;
import org.javai.retrrry.policy.StopPolicy;
import org.javai.retrrry.policy.StopStrategy;
import org.javai.retrrry.policy.WaitPolicy;
import org.javai.retrrry.policy.WaitStrategy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;
import java.util.function.Predicate;

/**
 * Every option a {@link Retrier} recognizes, by its configuration name.
 *
 * <p>Options marked textual can be read from plain text (properties, environment). The rest
 * take objects (predicates, policies, hooks) and are only accepted programmatically.
 */
public enum RetryOption {

    STOP_MAX_ATTEMPT_NUMBER("stop_max_attempt_number", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.stopMaxAttemptNumber(Math.toIntExact(toLong(value)));
        }
    },
    STOP_MAX_DELAY("stop_max_delay", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.stopMaxDelay(toLong(value));
        }
    },
    WAIT_FIXED("wait_fixed", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.waitFixed(toLong(value));
        }
    },
    WAIT_RANDOM_MIN("wait_random_min", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.waitRandomMin(toLong(value));
        }
    },
    WAIT_RANDOM_MAX("wait_random_max", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.waitRandomMax(toLong(value));
        }
    },
    WAIT_INCREMENTING_START("wait_incrementing_start", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.waitIncrementingStart(toLong(value));
        }
    },
    WAIT_INCREMENTING_INCREMENT("wait_incrementing_increment", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.waitIncrementingIncrement(toLong(value));
        }
    },
    WAIT_INCREMENTING_MAX("wait_incrementing_max", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.waitIncrementingMax(toLong(value));
        }
    },
    WAIT_EXPONENTIAL_MULTIPLIER("wait_exponential_multiplier", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.waitExponentialMultiplier(toLong(value));
        }
    },
    WAIT_EXPONENTIAL_MAX("wait_exponential_max", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.waitExponentialMax(toLong(value));
        }
    },
    WAIT_JITTER_MAX("wait_jitter_max", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.waitJitterMax(toLong(value));
        }
    },

    /**
     * A {@code Predicate<Throwable>}, or exception types as a collection, array or
     * comma-separated class names.
     */
    RETRY_ON_EXCEPTION("retry_on_exception", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            if (value instanceof Predicate<?> predicate) {
                builder.retryOnException((Predicate<Throwable>) predicate);
            } else {
                builder.retryOnException(RejectionPolicy.retryIfExceptionOfType(toThrowableTypes(value)));
            }
        }
    },
    RETRY_ON_RESULT("retry_on_result", false) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.retryOnResult((Predicate<Object>) require(value, Predicate.class));
        }
    },
    WRAP_EXCEPTION("wrap_exception", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.wrapException(toBoolean(value));
        }
    },
    STOP_FUNC("stop_func", false) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.stopFunc(require(value, StopPolicy.class));
        }
    },
    WAIT_FUNC("wait_func", false) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.waitFunc(require(value, WaitPolicy.class));
        }
    },
    STOP("stop", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            if (value instanceof StopStrategy strategy) {
                builder.stopStrategy(strategy);
            } else {
                builder.stopStrategy(require(value, String.class).trim());
            }
        }
    },
    WAIT("wait", true) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            if (value instanceof WaitStrategy strategy) {
                builder.waitStrategy(strategy);
            } else {
                builder.waitStrategy(require(value, String.class).trim());
            }
        }
    },
    BEFORE_ATTEMPTS("before_attempts", false) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.beforeAttempts(require(value, IntConsumer.class));
        }
    },
    AFTER_ATTEMPTS("after_attempts", false) {
        @Override
        void applyTo(Retrier.Builder builder, Object value) {
            builder.afterAttempts(require(value, IntConsumer.class));
        }
    };

    private final String optionName;
    private final boolean textual;

    RetryOption(String optionName, boolean textual) {
        this.optionName = optionName;
        this.textual = textual;
    }

    public String optionName() {
        return optionName;
    }

    /**
     * Whether the option can be read from plain text.
     */
    public boolean isTextual() {
        return textual;
    }

    /**
     * Applies a value to the builder, converting it as the option requires.
     *
     * @throws IllegalArgumentException if the value has the wrong type or cannot be parsed
     */
    public void apply(Retrier.Builder builder, Object value) {
        Objects.requireNonNull(builder, "builder must not be null");
        if (value == null) {
            throw new IllegalArgumentException("Option '" + optionName + "' must not be null");
        }
        try {
            applyTo(builder, value);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Option '" + optionName + "' is out of range: " + value, e);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for option '" + optionName + "': " + e.getMessage(), e);
        }
    }

    abstract void applyTo(Retrier.Builder builder, Object value);

    /**
     * @throws IllegalArgumentException if no option has the given name
     */
    public static RetryOption fromName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        for (RetryOption option : values()) {
            if (option.optionName.equals(name)) {
                return option;
            }
        }
        throw new IllegalArgumentException("Unknown retry option: " + name);
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a number: '" + text + "'", e);
            }
        }
        throw new IllegalArgumentException("expected a number, got " + value.getClass().getName());
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            String normalized = text.trim();
            if (normalized.equalsIgnoreCase("true")) {
                return true;
            }
            if (normalized.equalsIgnoreCase("false")) {
                return false;
            }
            throw new IllegalArgumentException("not a boolean: '" + text + "'");
        }
        throw new IllegalArgumentException("expected a boolean, got " + value.getClass().getName());
    }

    private static <V> V require(Object value, Class<V> type) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                    "expected " + type.getSimpleName() + ", got " + value.getClass().getName());
        }
        return type.cast(value);
    }

    private static List<Class<? extends Throwable>> toThrowableTypes(Object value) {
        List<Object> elements = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            elements.addAll(collection);
        } else if (value instanceof Class<?>[] array) {
            elements.addAll(Arrays.asList(array));
        } else if (value instanceof Class<?> single) {
            elements.add(single);
        } else if (value instanceof String text) {
            for (String className : text.split(",")) {
                if (!className.isBlank()) {
                    elements.add(loadClass(className.trim()));
                }
            }
        } else {
            throw new IllegalArgumentException("expected a predicate or exception types, got " + value.getClass().getName());
        }

        List<Class<? extends Throwable>> types = new ArrayList<>();
        for (Object element : elements) {
            if (!(element instanceof Class<?> type) || !Throwable.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(element + " is not a Throwable type");
            }
            types.add(type.asSubclass(Throwable.class));
        }
        return types;
    }

    private static Class<?> loadClass(String className) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = RetryOption.class.getClassLoader();
        }
        try {
            return Class.forName(className, false, loader);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("class not found: " + className, e);
        }
    }
}
