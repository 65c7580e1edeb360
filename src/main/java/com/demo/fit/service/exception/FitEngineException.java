package com.demo.fit.service.exception;

/**
 * Base of the engine's failures. {@link #reasonCode()} is the stable code reported to callers and batch results.
 */
public abstract class FitEngineException extends RuntimeException {

    protected FitEngineException(String message) {
        super(message);
    }

    protected FitEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String reasonCode();
}
