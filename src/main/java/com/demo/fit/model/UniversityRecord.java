package com.demo.fit.model;

/**
 * Static catalog entry. {@code acceptanceRate} is a percentage (e.g. 3.9 for 3.9%) and may be null when unknown.
 */
public record UniversityRecord(
        String universityId,
        String name,
        Integer rank,
        Double acceptanceRate,
        String state,
        String city,
        String marketPosition
) {}
