package com.demo.fit.service.exception;

public class UniversityNotFoundException extends FitEngineException {

    public UniversityNotFoundException(String universityId) {
        super("University not in catalog: " + universityId);
    }

    @Override
    public String reasonCode() {
        return "university_not_found";
    }
}
