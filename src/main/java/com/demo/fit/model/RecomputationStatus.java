package com.demo.fit.model;

/**
 * @param staleCount   records computed against an older profile version
 * @param missingCount catalog entries with no record yet (0 when no catalog was supplied)
 */
public record RecomputationStatus(boolean needed, String reason, long currentVersion, int staleCount, int missingCount) {}
