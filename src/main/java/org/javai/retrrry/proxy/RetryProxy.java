package org.javai.retrrry.proxy;

import org.javai.retrrry.Retrier;
import org.javai.retrrry.report.RetryReporter;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Creates dynamic proxies that retry the {@link Retry}-annotated methods of an interface.
 *
 * <p>A {@link Retrier} is built once per annotated method when the proxy is created, so invalid
 * options fail fast. Methods without the annotation are passed straight to the target.
 * Failures raised by the target surface unwrapped, exactly as the target threw them.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * interface UserApi {
 *     @Retry(stopMaxAttemptNumber = 3, waitFixed = 200, retryOn = IOException.class)
 *     User fetch(long id) throws IOException;
 * }
 *
 * UserApi api = RetryProxy.create(UserApi.class, new HttpUserApi(client));
 * }</pre>
 */
public final class RetryProxy {

    private RetryProxy() {
    }

    public static <I> I create(Class<I> type, I target) {
        return create(type, target, RetryReporter.noOp());
    }

    /**
     * @param type the interface to proxy
     * @param target the implementation receiving the calls
     * @param reporter reporter shared by the retriers of all annotated methods
     * @throws IllegalArgumentException if type is not an interface or an annotation holds invalid options
     */
    public static <I> I create(Class<I> type, I target, RetryReporter reporter) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(reporter, "reporter must not be null");
        if (!type.isInterface()) {
            throw new IllegalArgumentException(type.getName() + " is not an interface");
        }

        Map<Method, Retrier> retriers = new HashMap<>();
        Map<Method, Method> invocables = new HashMap<>();
        for (Method method : type.getMethods()) {
            if (!Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
                invocables.put(method, accessible(method));
            }
            Retry retry = method.getAnnotation(Retry.class);
            if (retry != null) {
                retriers.put(method, retrierFor(type.getSimpleName() + "." + method.getName(), retry, reporter));
            }
        }

        InvocationHandler handler = new RetryingHandler(target, Map.copyOf(retriers), Map.copyOf(invocables));
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, handler));
    }

    /**
     * Opens a method of a non-public interface so the handler can call the target through it.
     *
     * @throws IllegalArgumentException if the method cannot be made accessible
     */
    private static Method accessible(Method method) {
        if (!method.trySetAccessible()) {
            throw new IllegalArgumentException("Cannot access " + method.getDeclaringClass().getName()
                    + "." + method.getName() + ", make the interface public or open its package");
        }
        return method;
    }

    static Retrier retrierFor(String name, Retry retry, RetryReporter reporter) {
        Retrier.Builder builder = Retrier.builder().name(name).reporter(reporter);

        if (retry.stopMaxAttemptNumber() != Retry.UNSET) {
            builder.stopMaxAttemptNumber(retry.stopMaxAttemptNumber());
        }
        if (retry.stopMaxDelay() != Retry.UNSET) {
            builder.stopMaxDelay(retry.stopMaxDelay());
        }
        if (retry.waitFixed() != Retry.UNSET) {
            builder.waitFixed(retry.waitFixed());
        }
        if (retry.waitRandomMin() != Retry.UNSET) {
            builder.waitRandomMin(retry.waitRandomMin());
        }
        if (retry.waitRandomMax() != Retry.UNSET) {
            builder.waitRandomMax(retry.waitRandomMax());
        }
        if (retry.waitIncrementingStart() != Retry.UNSET) {
            builder.waitIncrementingStart(retry.waitIncrementingStart());
        }
        if (retry.waitIncrementingIncrement() != Retry.UNSET) {
            builder.waitIncrementingIncrement(retry.waitIncrementingIncrement());
        }
        if (retry.waitIncrementingMax() != Retry.UNSET) {
            builder.waitIncrementingMax(retry.waitIncrementingMax());
        }
        if (retry.waitExponentialMultiplier() != Retry.UNSET) {
            builder.waitExponentialMultiplier(retry.waitExponentialMultiplier());
        }
        if (retry.waitExponentialMax() != Retry.UNSET) {
            builder.waitExponentialMax(retry.waitExponentialMax());
        }
        if (retry.waitJitterMax() != Retry.UNSET) {
            builder.waitJitterMax(retry.waitJitterMax());
        }
        if (retry.retryOn().length > 0) {
            builder.retryOnExceptionOfType(Arrays.asList(retry.retryOn()));
        }
        if (retry.retryOnNullResult()) {
            builder.retryOnResult(Objects::isNull);
        }
        if (!retry.stopStrategy().isEmpty()) {
            builder.stopStrategy(retry.stopStrategy());
        }
        if (!retry.waitStrategy().isEmpty()) {
            builder.waitStrategy(retry.waitStrategy());
        }
        return builder.wrapException(retry.wrapException()).build();
    }

    private static final class RetryingHandler implements InvocationHandler {
        private final Object target;
        private final Map<Method, Retrier> retriers;
        private final Map<Method, Method> invocables;

        private RetryingHandler(Object target, Map<Method, Retrier> retriers, Map<Method, Method> invocables) {
            this.target = target;
            this.retriers = retriers;
            this.invocables = invocables;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            Retrier retrier = retriers.get(method);
            if (retrier == null) {
                return invokeTarget(method, args);
            }
            return retrier.call(() -> invokeTarget(method, args));
        }

        private Object invokeTarget(Method method, Object[] args) throws Exception {
            try {
                return invocables.getOrDefault(method, method).invoke(target, args);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception exception) {
                    throw exception;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw e;
            }
        }
    }
}
