package com.demo.fit.service.exception;

public class ProfileNotFoundException extends FitEngineException {

    public ProfileNotFoundException(String userId) {
        super("No profile found for user " + userId + ". Please upload a profile first.");
    }

    @Override
    public String reasonCode() {
        return "profile_not_found";
    }
}
