package com.demo.fit.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Cached fit for one (user, university) pair. Always written whole; a recompute replaces every field.
 */
public record FitRecord(
        String userId,
        String universityId,
        int matchPercentage,
        FitCategory fitCategory,
        SelectivityTier selectivityTier,
        List<FitFactor> factors,
        String explanation,
        GapAnalysis gapAnalysis,
        List<Recommendation> recommendations,
        List<EssayAngle> essayAngles,
        List<ScholarshipMatch> scholarshipMatches,
        ApplicationTimeline applicationTimeline,
        JsonNode testStrategy,
        JsonNode majorStrategy,
        List<String> demonstratedInterestTips,
        List<String> redFlagsToAvoid,
        Instant computedAt,
        long profileVersion
) {
    public boolean staleAgainst(long currentProfileVersion) {
        return profileVersion != currentProfileVersion;
    }
}
