package org.javai.retrrry.proxy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an interface method whose calls should be retried when invoked through a {@link RetryProxy}.
 *
 * <p>Every option is optional; a bare {@code @Retry} uses the defaults (retry every failure, no
 * stop bound, no wait). Numeric options left at {@link #UNSET} are treated as not configured.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Retry {

    long UNSET = -1L;

    int stopMaxAttemptNumber() default (int) UNSET;

    long stopMaxDelay() default UNSET;

    long waitFixed() default UNSET;

    long waitRandomMin() default UNSET;

    long waitRandomMax() default UNSET;

    long waitIncrementingStart() default UNSET;

    long waitIncrementingIncrement() default UNSET;

    long waitIncrementingMax() default UNSET;

    long waitExponentialMultiplier() default UNSET;

    long waitExponentialMax() default UNSET;

    long waitJitterMax() default UNSET;

    /**
     * Only failures of these types are retried. Empty means every failure is retried.
     */
    Class<? extends Throwable>[] retryOn() default {};

    /**
     * Retry when the method returns null.
     */
    boolean retryOnNullResult() default false;

    boolean wrapException() default false;

    /**
     * Name of a built-in stop strategy, e.g. {@code stop_after_attempt}. Empty means composed.
     */
    String stopStrategy() default "";

    /**
     * Name of a built-in wait strategy, e.g. {@code exponential_sleep}. Empty means composed.
     */
    String waitStrategy() default "";
}
