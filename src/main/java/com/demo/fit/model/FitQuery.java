package com.demo.fit.model;

import java.util.List;

/**
 * Filtered read over a user's fit matrix.
 */
public record FitQuery(
        FitCategory category,
        String state,
        List<String> excludeIds,
        int limit,
        int offset,
        SortBy sortBy
) {
    public enum SortBy {
        RANK,
        MATCH_SCORE;

        public static SortBy parse(String raw) {
            if (raw == null || raw.isBlank()) return RANK;
            return switch (raw.trim().toLowerCase(java.util.Locale.ROOT)) {
                case "match_score", "match", "score" -> MATCH_SCORE;
                case "rank" -> RANK;
                default -> throw new IllegalArgumentException("Unknown sort_by: " + raw);
            };
        }
    }

    public FitQuery withCategory(FitCategory newCategory, int newLimit) {
        return new FitQuery(newCategory, state, excludeIds, newLimit, 0, sortBy);
    }
}
