package io.cloudsoft.gax4j.client;

import static java.util.Objects.requireNonNull;

import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;

import io.cloudsoft.gax4j.client.retry.Clock;
import io.cloudsoft.gax4j.client.retry.LimitedDurationRetryPolicy;
import io.cloudsoft.gax4j.client.retry.LimitedErrorCountRetryPolicy;
import io.cloudsoft.gax4j.client.retry.RetryPolicy;

public class RetryingClientBuilder<T> {
    /**
     * Maximum duration applied by default to each attempt.
     */
    public static final Duration DEFAULT_RPC_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_FAILURES = 3;

    protected final Class<T> stubType;
    protected final T stub;
    protected Clock clock;
    protected RetryPolicy retryPolicy;
    protected StatusClassifier statusClassifier;
    protected DeadlineApplier deadlineApplier;
    protected Predicate<Method> retryableMethods;

    RetryingClientBuilder(Class<T> stubType, T stub) {
        this.stubType = requireNonNull(stubType, "stubType");
        this.stub = requireNonNull(stub, "stub");
        if (!stubType.isInterface()) {
            throw new IllegalArgumentException("stubType should be an interface: " + stubType.getName());
        }
        if (!stubType.isInstance(stub)) {
            throw new IllegalArgumentException("stub does not implement " + stubType.getName());
        }
        clock(Clock.system());
        statusClassifier(new WebServiceStatusClassifier());
        deadlineApplier(new CxfDeadlineApplier());
        retryableMethods(m -> true);
    }

    /**
     * Clock used by the default retry policy and to turn deadlines into transport timeouts.
     */
    public RetryingClientBuilder<T> clock(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
        return this;
    }

    /**
     * @param retryPolicy prototype cloned for every call;
     *                    default value {@link #limitedErrorCountRetryPolicy(int)} with {@link #DEFAULT_MAX_FAILURES}
     */
    public RetryingClientBuilder<T> retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = requireNonNull(retryPolicy, "retryPolicy");
        return this;
    }

    /**
     * @param statusClassifier decides which failures are transient;
     *                         default value {@link WebServiceStatusClassifier}
     */
    public RetryingClientBuilder<T> statusClassifier(StatusClassifier statusClassifier) {
        this.statusClassifier = requireNonNull(statusClassifier, "statusClassifier");
        return this;
    }

    /**
     * @param deadlineApplier passes the deadline of each attempt on to the stub;
     *                        default value {@link CxfDeadlineApplier}
     */
    public RetryingClientBuilder<T> deadlineApplier(DeadlineApplier deadlineApplier) {
        this.deadlineApplier = requireNonNull(deadlineApplier, "deadlineApplier");
        return this;
    }

    /**
     * @param retryableMethods methods for which failures are retried; others are invoked exactly once.
     *                         By default every method is retried.
     */
    public RetryingClientBuilder<T> retryableMethods(Predicate<Method> retryableMethods) {
        this.retryableMethods = requireNonNull(retryableMethods, "retryableMethods");
        return this;
    }

    /**
     * Never retry the methods with these names, e.g. calls that are not idempotent.
     */
    public RetryingClientBuilder<T> nonRetryableMethods(String... methodNames) {
        Set<String> names = new HashSet<>(Arrays.asList(methodNames));
        Predicate<Method> previous = retryableMethods;
        return retryableMethods(m -> !names.contains(m.getName()) && previous.test(m));
    }

    public static RetryPolicy limitedErrorCountRetryPolicy(int maxFailures) {
        return new LimitedErrorCountRetryPolicy(maxFailures, DEFAULT_RPC_TIMEOUT);
    }

    public static RetryPolicy limitedDurationRetryPolicy(Duration maxDuration) {
        return new LimitedDurationRetryPolicy(maxDuration, DEFAULT_RPC_TIMEOUT);
    }

    /**
     * Create a proxy implementing the stub interface with retries
     */
    public T build() {
        RetryPolicy prototype = retryPolicy != null
                ? retryPolicy
                : new LimitedErrorCountRetryPolicy(DEFAULT_MAX_FAILURES, DEFAULT_RPC_TIMEOUT, clock);
        RetryingProxyHandler handler = new RetryingProxyHandler(stub, prototype, statusClassifier,
                deadlineApplier, clock, retryableMethods);
        return stubType.cast(Proxy.newProxyInstance(stubType.getClassLoader(),
                new Class<?>[] {stubType},
                handler));
    }
}
