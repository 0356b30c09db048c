package com.purchasingpower.fanout.backend;

/**
 * A routed call failed on the serving backend and on its fallback.
 * The fallback failure is attached as a suppressed exception.
 */
public class BackendOperationException extends RuntimeException {

    private final BackendOperation operation;

    public BackendOperationException(BackendOperation operation,
                                     String firstBackend, RuntimeException firstCause,
                                     String fallbackBackend, RuntimeException fallbackCause) {
        super(String.format("Both backends failed for %s. %s: %s, %s: %s",
                operation, firstBackend, firstCause.getMessage(), fallbackBackend, fallbackCause.getMessage()),
                firstCause);
        this.operation = operation;
        addSuppressed(fallbackCause);
    }

    public BackendOperation getOperation() {
        return operation;
    }
}
