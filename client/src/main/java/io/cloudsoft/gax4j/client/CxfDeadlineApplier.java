package io.cloudsoft.gax4j.client;

import java.time.Duration;
import java.time.Instant;

import jakarta.xml.ws.BindingProvider;

import org.apache.cxf.endpoint.ClientImpl;
import org.apache.cxf.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cloudsoft.gax4j.client.retry.Clock;

/**
 * Sets the receive timeout of the next request made through a CXF client stub so the attempt gives up
 * at the deadline.
 *
 * The timeout goes into the request context of the calling thread, never into the shared conduit, so
 * concurrent calls through the same stub each keep their own deadline. Stubs that are not
 * {@link BindingProvider}s are left alone.
 */
public class CxfDeadlineApplier implements DeadlineApplier {
    private static final Logger LOG = LoggerFactory.getLogger(CxfDeadlineApplier.class);

    @Override
    public void apply(Object stub, Instant deadline, Clock clock) {
        if (!(stub instanceof BindingProvider)) {
            LOG.debug("Not a JAX-WS binding provider, not applying deadline {} to {}", deadline, stub.getClass().getName());
            return;
        }
        BindingProvider bp = (BindingProvider) stub;
        enableThreadLocalRequestContext(bp);
        bp.getRequestContext().put(Message.RECEIVE_TIMEOUT, toReceiveTimeout(deadline, clock));
    }

    // must be switched on before any thread puts its timeout, or the timeout lands in the shared context
    private static void enableThreadLocalRequestContext(BindingProvider bp) {
        synchronized (bp) {
            if (!Boolean.parseBoolean(String.valueOf(bp.getRequestContext().get(ClientImpl.THREAD_LOCAL_REQUEST_CONTEXT)))) {
                bp.getRequestContext().put(ClientImpl.THREAD_LOCAL_REQUEST_CONTEXT, Boolean.TRUE.toString());
            }
        }
    }

    /**
     * CXF treats {@code 0} as "no timeout", so an elapsed deadline is mapped to the smallest real timeout.
     * Socket timeouts are ints, so far away deadlines are capped at {@link Integer#MAX_VALUE}.
     */
    static long toReceiveTimeout(Instant deadline, Clock clock) {
        long remaining;
        try {
            remaining = Duration.between(clock.now(), deadline).toMillis();
        } catch (ArithmeticException e) {
            remaining = Integer.MAX_VALUE;
        }
        return Math.min(Integer.MAX_VALUE, Math.max(1L, remaining));
    }
}
