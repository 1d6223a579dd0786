package org.javai.retrrry.policy;

import org.javai.retrrry.Outcome;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides whether an attempt's outcome is unsatisfactory and should be retried.
 *
 * <p>A failed outcome is judged only by the failure predicate; a produced value only by the
 * result predicate.
 */
public final class RejectionPolicy {

    private static final Predicate<Throwable> ALWAYS_REJECT = throwable -> true;
    private static final Predicate<Object> NEVER_REJECT = result -> false;

    private final Predicate<Throwable> retryOnException;
    private final Predicate<Object> retryOnResult;

    private RejectionPolicy(Predicate<Throwable> retryOnException, Predicate<Object> retryOnResult) {
        this.retryOnException = Objects.requireNonNull(retryOnException, "retryOnException must not be null");
        this.retryOnResult = Objects.requireNonNull(retryOnResult, "retryOnResult must not be null");
    }

    /**
     * Retries every failure and accepts every produced value.
     */
    public static RejectionPolicy defaults() {
        return new RejectionPolicy(ALWAYS_REJECT, NEVER_REJECT);
    }

    /**
     * Creates a policy from the given predicates; a null predicate falls back to its default.
     */
    public static RejectionPolicy of(Predicate<Throwable> retryOnException, Predicate<Object> retryOnResult) {
        return new RejectionPolicy(
                retryOnException == null ? ALWAYS_REJECT : retryOnException,
                retryOnResult == null ? NEVER_REJECT : retryOnResult);
    }

    /**
     * Normalizes a set of exception types into a predicate matching instances of any of them.
     */
    public static Predicate<Throwable> retryIfExceptionOfType(Collection<? extends Class<? extends Throwable>> types) {
        List<Class<? extends Throwable>> retryable = List.copyOf(Objects.requireNonNull(types, "types must not be null"));
        return throwable -> {
            for (Class<? extends Throwable> type : retryable) {
                if (type.isInstance(throwable)) {
                    return true;
                }
            }
            return false;
        };
    }

    /**
     * @return true if the outcome should be retried (when the stop policy allows it)
     */
    public boolean shouldReject(Outcome<?> outcome) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (outcome instanceof Outcome.Fail<?> fail) {
            return retryOnException.test(fail.failure().exception());
        }
        return retryOnResult.test(((Outcome.Ok<?>) outcome).value());
    }
}
