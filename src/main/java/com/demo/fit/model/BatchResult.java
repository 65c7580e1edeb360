package com.demo.fit.model;

import java.time.Instant;
import java.util.List;

/**
 * Result of one recompute pass over a list of universities.
 *
 * @param computed       fresh computations (evaluator called, credit charged)
 * @param fromCache      entries that were already current
 * @param failures       per-university failures; siblings are unaffected
 * @param fitsComputedAt marker written when the pass finished
 */
public record BatchResult(
        int computed,
        int fromCache,
        List<Failure> failures,
        Instant fitsComputedAt
) {
    public record Failure(String universityId, String reason, String message) {}
}
