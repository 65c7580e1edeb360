package com.demo.fit.service.exception;

public class StoreUnavailableException extends FitEngineException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reasonCode() {
        return "store_unavailable";
    }
}
