package io.cloudsoft.gax4j.client;

import java.io.IOException;
import java.net.SocketTimeoutException;

import jakarta.xml.ws.WebServiceException;
import jakarta.xml.ws.soap.SOAPFaultException;

/**
 * Classifies the exceptions thrown by JAX-WS stubs.
 * 
 * Only failures to reach the service (an {@link IOException} underneath a {@link WebServiceException})
 * are considered transient. A SOAP fault means the service processed and rejected the request, so
 * sending it again would give the same answer.
 */
public class WebServiceStatusClassifier implements StatusClassifier {

    @Override
    public Status classify(Throwable failure) {
        if (failure instanceof StatusException) {
            return ((StatusException) failure).getStatus();
        }
        if (failure instanceof SOAPFaultException) {
            return Status.of(StatusCode.INVALID_ARGUMENT, describe(failure));
        }
        if (failure instanceof WebServiceException) {
            Throwable cause = failure.getCause();
            if (cause instanceof SocketTimeoutException) {
                return Status.of(StatusCode.DEADLINE_EXCEEDED, describe(cause));
            }
            if (cause instanceof IOException) {
                return Status.of(StatusCode.UNAVAILABLE, describe(cause));
            }
            return Status.of(StatusCode.INTERNAL, describe(failure));
        }
        return Status.of(StatusCode.UNKNOWN, describe(failure));
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}
