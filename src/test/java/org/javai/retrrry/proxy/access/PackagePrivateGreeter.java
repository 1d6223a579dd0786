package org.javai.retrrry.proxy.access;

import org.javai.retrrry.proxy.Retry;
import org.javai.retrrry.proxy.RetryProxy;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exposes a proxy over an interface that is only visible inside this package.
 */
public final class PackagePrivateGreeter {

    interface Greeter {
        @Retry(stopMaxAttemptNumber = 3)
        String greet(String name);
    }

    private final AtomicInteger calls = new AtomicInteger();
    private final Greeter greeter;

    public PackagePrivateGreeter(int failuresBeforeSuccess) {
        Greeter target = name -> {
            if (calls.incrementAndGet() <= failuresBeforeSuccess) {
                throw new IllegalStateException("not ready");
            }
            return "hello " + name;
        };
        this.greeter = RetryProxy.create(Greeter.class, target);
    }

    public String greet(String name) {
        return greeter.greet(name);
    }

    public int calls() {
        return calls.get();
    }
}
