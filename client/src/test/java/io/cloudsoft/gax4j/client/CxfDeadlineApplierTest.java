package io.cloudsoft.gax4j.client;

import static org.testng.Assert.assertEquals;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import jakarta.jws.WebService;
import jakarta.xml.ws.BindingProvider;

import org.apache.cxf.frontend.ClientProxy;
import org.apache.cxf.jaxws.JaxWsProxyFactoryBean;
import org.apache.cxf.message.Message;
import org.apache.cxf.transport.http.HTTPConduit;
import org.apache.cxf.transports.http.configuration.HTTPClientPolicy;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.cloudsoft.gax4j.client.retry.MutableClock;

public class CxfDeadlineApplierTest {
    private static final Instant T0 = Instant.parse("2019-05-01T10:00:00Z");

    @WebService(targetNamespace = "http://gax4j.cloudsoft.io/test")
    public interface EchoPort {
        String echo(String message);
    }

    private EchoPort port;

    @BeforeMethod(alwaysRun=true)
    public void setUp() {
        JaxWsProxyFactoryBean factory = new JaxWsProxyFactoryBean();
        factory.setServiceClass(EchoPort.class);
        factory.setAddress("http://localhost:9/echo");
        port = (EchoPort) factory.create();
    }

    @AfterMethod(alwaysRun=true)
    public void tearDown() {
        ClientProxy.getClient(port).destroy();
    }

    private Object receiveTimeoutOfCurrentThread() {
        return ((BindingProvider) port).getRequestContext().get(Message.RECEIVE_TIMEOUT);
    }

    private static Long receiveTimeoutOf(HTTPConduit conduit) {
        HTTPClientPolicy policy = conduit.getClient();
        return policy == null ? null : policy.getReceiveTimeout();
    }

    @Test
    public void testRemainingTimeBecomesReceiveTimeout() {
        MutableClock clock = new MutableClock(T0);
        assertEquals(CxfDeadlineApplier.toReceiveTimeout(T0.plusMillis(1500), clock), 1500L);
        clock.set(T0.plusMillis(1499));
        assertEquals(CxfDeadlineApplier.toReceiveTimeout(T0.plusMillis(1500), clock), 1L);
    }

    @Test
    public void testElapsedDeadlineIsShortestTimeout() {
        MutableClock clock = new MutableClock(T0.plusSeconds(10));
        assertEquals(CxfDeadlineApplier.toReceiveTimeout(T0, clock), 1L);
        assertEquals(CxfDeadlineApplier.toReceiveTimeout(T0.plusSeconds(10), clock), 1L);
    }

    @Test
    public void testFarDeadlineIsCapped() {
        MutableClock clock = new MutableClock(T0);
        assertEquals(CxfDeadlineApplier.toReceiveTimeout(Instant.MAX, clock), (long) Integer.MAX_VALUE);
        assertEquals(CxfDeadlineApplier.toReceiveTimeout(T0.plus(30, ChronoUnit.DAYS), clock),
                (long) Integer.MAX_VALUE);
    }

    @Test
    public void testIgnoresPlainObjects() {
        new CxfDeadlineApplier().apply(new Object(), T0, new MutableClock(T0));
    }

    @Test
    public void testSetsReceiveTimeoutOnRequestNotConduit() {
        HTTPConduit conduit = (HTTPConduit) ClientProxy.getClient(port).getConduit();
        Long conduitTimeout = receiveTimeoutOf(conduit);

        new CxfDeadlineApplier().apply(port, T0.plusMillis(2500), new MutableClock(T0));

        assertEquals(receiveTimeoutOfCurrentThread(), 2500L);
        assertEquals(receiveTimeoutOf(conduit), conduitTimeout);
    }

    @Test(timeOut=30000)
    public void testConcurrentCallsKeepOwnTimeouts() throws Exception {
        CxfDeadlineApplier applier = new CxfDeadlineApplier();
        MutableClock clock = new MutableClock(T0);
        CyclicBarrier bothApplied = new CyclicBarrier(2);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Object> first = executor.submit(applyThenRead(applier, clock, 60000, bothApplied));
            Future<Object> second = executor.submit(applyThenRead(applier, clock, 1, bothApplied));

            assertEquals(first.get(10, TimeUnit.SECONDS), 60000L);
            assertEquals(second.get(10, TimeUnit.SECONDS), 1L);
        } finally {
            executor.shutdownNow();
        }
    }

    private Callable<Object> applyThenRead(CxfDeadlineApplier applier, MutableClock clock, long millis,
            CyclicBarrier bothApplied) {
        return () -> {
            applier.apply(port, T0.plusMillis(millis), clock);
            bothApplied.await(10, TimeUnit.SECONDS);
            return receiveTimeoutOfCurrentThread();
        };
    }
}
