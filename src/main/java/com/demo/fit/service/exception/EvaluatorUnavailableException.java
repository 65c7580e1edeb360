package com.demo.fit.service.exception;

public class EvaluatorUnavailableException extends FitEngineException {

    public EvaluatorUnavailableException(String message) {
        super(message);
    }

    public EvaluatorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reasonCode() {
        return "evaluator_unavailable";
    }
}
