package com.purchasingpower.fanout.engine;

/**
 * A search engine call failed (transport error, non-success status, unparseable body).
 */
public class EngineException extends RuntimeException {

    private final String engineCode;

    public EngineException(String engineCode, String message) {
        super(engineCode + ": " + message);
        this.engineCode = engineCode;
    }

    public EngineException(String engineCode, String message, Throwable cause) {
        super(engineCode + ": " + message, cause);
        this.engineCode = engineCode;
    }

    public String getEngineCode() {
        return engineCode;
    }
}
