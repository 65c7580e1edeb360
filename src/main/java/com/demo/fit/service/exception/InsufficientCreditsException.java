package com.demo.fit.service.exception;

public class InsufficientCreditsException extends FitEngineException {

    private final int creditsRemaining;
    private final int creditsNeeded;

    public InsufficientCreditsException(String userId, int creditsRemaining, int creditsNeeded) {
        super("Insufficient credits for " + userId + ": remaining=" + creditsRemaining + ", needed=" + creditsNeeded);
        this.creditsRemaining = creditsRemaining;
        this.creditsNeeded = creditsNeeded;
    }

    public int getCreditsRemaining() {
        return creditsRemaining;
    }

    public int getCreditsNeeded() {
        return creditsNeeded;
    }

    @Override
    public String reasonCode() {
        return "insufficient_credits";
    }
}
