package io.cloudsoft.gax4j.client;

/**
 * Turns the exception thrown by one attempt of a stub method into a {@link Status}.
 * 
 * @see WebServiceStatusClassifier
 */
@FunctionalInterface
public interface StatusClassifier {

    Status classify(Throwable failure);
}
