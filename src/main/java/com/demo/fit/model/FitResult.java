package com.demo.fit.model;

/**
 * Outcome of a single fit computation.
 *
 * @param record           the served record
 * @param fromCache        true when no evaluator call or charge happened
 * @param creditsRemaining balance after the charge; null on a cache hit
 */
public record FitResult(FitRecord record, boolean fromCache, Integer creditsRemaining) {

    public static FitResult cached(FitRecord record) {
        return new FitResult(record, true, null);
    }

    public static FitResult computed(FitRecord record, int creditsRemaining) {
        return new FitResult(record, false, creditsRemaining);
    }
}
