package io.cloudsoft.gax4j.client;

/**
 * Entry point for wrapping generated stubs with retries.
 * 
 * <pre>
 * EchoPort port = RetryingClients.builder(EchoPort.class, generatedPort)
 *         .retryPolicy(new LimitedDurationRetryPolicy(Duration.ofMinutes(1), Duration.ofSeconds(10)))
 *         .nonRetryableMethods("submit")
 *         .build();
 * </pre>
 */
public final class RetryingClients {

    private RetryingClients() {
    }

    public static <T> RetryingClientBuilder<T> builder(Class<T> stubType, T stub) {
        return new RetryingClientBuilder<>(stubType, stub);
    }
}
