package com.demo.fit.service.exception;

public class FitNotComputedException extends FitEngineException {

    public FitNotComputedException(String userId, String universityId) {
        super("No fit computed yet for " + userId + " / " + universityId);
    }

    @Override
    public String reasonCode() {
        return "fit_not_computed";
    }
}
