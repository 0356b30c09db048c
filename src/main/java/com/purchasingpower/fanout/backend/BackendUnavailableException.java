package com.purchasingpower.fanout.backend;

/**
 * No backend can serve the request, or none could be initialized at startup.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
