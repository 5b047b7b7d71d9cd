package io.cloudsoft.gax4j.client;

import static java.util.Objects.requireNonNull;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.time.Instant;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cloudsoft.gax4j.client.retry.Clock;
import io.cloudsoft.gax4j.client.retry.RetryPolicy;

/**
 * Invokes the methods of a stub, retrying failed attempts for as long as the retry policy allows.
 * 
 * The prototype policy is never used directly: every call works on its own {@link RetryPolicy#clone()},
 * so one handler can serve concurrent calls.
 */
class RetryingProxyHandler implements InvocationHandler {
    private static final Logger LOG = LoggerFactory.getLogger(RetryingProxyHandler.class);

    private final Object stub;
    private final RetryPolicy retryPolicyPrototype;
    private final StatusClassifier statusClassifier;
    private final DeadlineApplier deadlineApplier;
    private final Clock clock;
    private final Predicate<Method> retryableMethods;

    RetryingProxyHandler(Object stub, RetryPolicy retryPolicyPrototype, StatusClassifier statusClassifier,
            DeadlineApplier deadlineApplier, Clock clock, Predicate<Method> retryableMethods) {
        this.stub = requireNonNull(stub, "stub");
        this.retryPolicyPrototype = requireNonNull(retryPolicyPrototype, "retryPolicy");
        this.statusClassifier = requireNonNull(statusClassifier, "statusClassifier");
        this.deadlineApplier = requireNonNull(deadlineApplier, "deadlineApplier");
        this.clock = requireNonNull(clock, "clock");
        this.retryableMethods = requireNonNull(retryableMethods, "retryableMethods");
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return invokeObjectMethod(proxy, method, args);
        }
        if (!retryableMethods.test(method)) {
            // e.g. non-idempotent calls, where a second attempt could repeat side effects
            try {
                return method.invoke(stub, args);
            } catch (InvocationTargetException e) {
                throw e.getTargetException();
            }
        }
        return invokeWithRetry(method, args);
    }

    public Object invokeWithRetry(Method method, Object[] args) throws IllegalAccessException {
        RetryPolicy retryPolicy = retryPolicyPrototype.clone();
        int attempt = 0;

        while (true) {
            attempt++;
            Instant deadline = retryPolicy.operationDeadline();
            LOG.trace("Attempt {} of \"{}\" with deadline {}", attempt, method.getName(), deadline);
            deadlineApplier.apply(stub, deadline, clock);
            Throwable failure;
            try {
                return method.invoke(stub, args);
            } catch (InvocationTargetException targetException) {
                failure = targetException.getTargetException();
            }

            Status status = statusClassifier.classify(failure);
            if (Thread.currentThread().isInterrupted()) {
                LOG.debug("Interrupted after attempt " + attempt + " of \"" + method.getName() + "\", not retrying");
                throw new StatusException(Status.of(StatusCode.CANCELLED, status.toString()), failure);
            }
            if (!retryPolicy.onFailure(status)) {
                LOG.debug("Failed task \"" + method.getName() + "\" after " + attempt + " attempt(s) with " + status
                        + " (" + retryPolicy + "), rethrowing last failure");
                throw new StatusException(status, failure);
            }
            LOG.debug("On attempt " + attempt + " of \"" + method.getName() + "\", ignoring " + status
                    + " and retrying (" + retryPolicy + ")", failure);
        }
    }

    private Object invokeObjectMethod(Object proxy, Method method, Object[] args) {
        switch (method.getName()) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            case "toString":
                return "Retrying[" + stub + ", " + retryPolicyPrototype + "]";
            default:
                throw new UnsupportedOperationException(method.toString());
        }
    }

    Object getStub() {
        return stub;
    }

    RetryPolicy getRetryPolicyPrototype() {
        return retryPolicyPrototype;
    }
}
