package com.demo.fit.model;

/** Paid operations that draw on the same credit balance. */
public enum MeteredOperation {
    FIT_RECOMPUTE("fit_analysis"),
    INFOGRAPHIC_REGENERATION("infographic_regeneration");

    private final String reason;

    MeteredOperation(String reason) {
        this.reason = reason;
    }

    /** Reason code written to the credit history. */
    public String reason() {
        return reason;
    }
}
