package com.demo.fit.service.exception;

/** The evaluator did not answer in time, or the caller's own wait for an in-flight computation expired. */
public class EvaluatorTimeoutException extends FitEngineException {

    public EvaluatorTimeoutException(String message) {
        super(message);
    }

    public EvaluatorTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reasonCode() {
        return "evaluator_timeout";
    }
}
