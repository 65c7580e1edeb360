package com.demo.fit.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Versioned student profile. The document itself is opaque to the engine; only {@code profileVersion} drives staleness.
 */
public record StudentProfile(
        String userId,
        long profileVersion,
        JsonNode document,
        Instant updatedAt,
        Instant fitsComputedAt,
        Long fitsProfileVersion
) {
    public boolean fitsReady() {
        return fitsComputedAt != null;
    }
}
