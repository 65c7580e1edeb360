package com.demo.fit.controller.dto;

import com.demo.fit.model.ApplicationTimeline;
import com.demo.fit.model.BatchResult;
import com.demo.fit.model.EssayAngle;
import com.demo.fit.model.FitFactor;
import com.demo.fit.model.FitRecord;
import com.demo.fit.model.FitView;
import com.demo.fit.model.GapAnalysis;
import com.demo.fit.model.Recommendation;
import com.demo.fit.model.RecomputationStatus;
import com.demo.fit.model.ScholarshipMatch;
import com.demo.fit.model.UniversityRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class FitDtos {

    private FitDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ComputeSingleFitRequest {
        @NotBlank
        public String userEmail;
        @NotBlank
        public String universityId;
        public boolean forceRecompute;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ComputeSingleFitResponse {
        public boolean success;
        public FitAnalysis fitAnalysis;
        public Boolean fromCache;
        public Integer creditsRemaining;

        // degraded responses only
        public String error;
        public Integer creditsNeeded;
        public Boolean degraded;
        public Boolean stale;
        public String message;
    }

    /** One fit as the UI renders it. Soft fits carry no score or artifacts. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FitAnalysis {
        public String universityId;
        public String universityName;
        public Integer usNewsRank;
        public Double acceptanceRate;
        public String state;
        public String city;
        public String marketPosition;

        public Integer matchPercentage;
        public String fitCategory;
        public String selectivityTier;
        public List<FitFactor> factors;
        public String explanation;
        public GapAnalysis gapAnalysis;
        public List<Recommendation> recommendations;
        public List<EssayAngle> essayAngles;
        public List<ScholarshipMatch> scholarshipMatches;
        public ApplicationTimeline applicationTimeline;
        public JsonNode testStrategy;
        public JsonNode majorStrategy;
        public List<String> demonstratedInterestTips;
        public List<String> redFlagsToAvoid;
        public Instant computedAt;
        public Long profileVersion;

        public boolean stale;
        public boolean isSoftFit;

        public static FitAnalysis from(FitRecord r, UniversityRecord u, boolean stale) {
            FitAnalysis a = new FitAnalysis();
            a.universityId = r.universityId();
            a.matchPercentage = r.matchPercentage();
            a.fitCategory = r.fitCategory().name();
            a.selectivityTier = r.selectivityTier().name();
            a.factors = r.factors();
            a.explanation = r.explanation();
            a.gapAnalysis = r.gapAnalysis();
            a.recommendations = r.recommendations();
            a.essayAngles = r.essayAngles();
            a.scholarshipMatches = r.scholarshipMatches();
            a.applicationTimeline = r.applicationTimeline();
            a.testStrategy = r.testStrategy();
            a.majorStrategy = r.majorStrategy();
            a.demonstratedInterestTips = r.demonstratedInterestTips();
            a.redFlagsToAvoid = r.redFlagsToAvoid();
            a.computedAt = r.computedAt();
            a.profileVersion = r.profileVersion();
            a.stale = stale;
            a.withUniversity(u);
            return a;
        }

        public static FitAnalysis from(FitView v) {
            if (v.softFit()) {
                FitAnalysis a = new FitAnalysis();
                a.universityId = v.university().universityId();
                a.fitCategory = v.category().name();
                a.isSoftFit = true;
                a.withUniversity(v.university());
                return a;
            }
            return from(v.record(), v.university(), v.stale());
        }

        private void withUniversity(UniversityRecord u) {
            if (u == null) return;
            universityName = u.name();
            usNewsRank = u.rank();
            acceptanceRate = u.acceptanceRate();
            state = u.state();
            city = u.city();
            marketPosition = u.marketPosition();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ComputeAllRequest {
        @NotBlank
        public String userEmail;
        public List<String> universityIds;   // null = whole catalog
        public boolean force;
    }

    public static class ComputeAllResponse {
        public boolean success;
        public int computed;
        public int fromCache;
        public int failed;
        public Instant fitsComputedAt;
        public List<FailureDto> failures;

        public static ComputeAllResponse from(BatchResult r) {
            ComputeAllResponse res = new ComputeAllResponse();
            res.success = true;
            res.computed = r.computed();
            res.fromCache = r.fromCache();
            res.failed = r.failures().size();
            res.fitsComputedAt = r.fitsComputedAt();
            res.failures = r.failures().stream().map(FailureDto::from).toList();
            return res;
        }
    }

    public static class FailureDto {
        public String universityId;
        public String reason;
        public String message;

        static FailureDto from(BatchResult.Failure f) {
            FailureDto d = new FailureDto();
            d.universityId = f.universityId();
            d.reason = f.reason();
            d.message = f.message();
            return d;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Filters {
        public String category;
        public String state;
        public List<String> excludeIds;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GetFitsRequest {
        @NotBlank
        public String userEmail;
        public Filters filters;
        public Integer limit;
        public Integer offset;
        public String sortBy;
    }

    public static class GetFitsResponse {
        public boolean success;
        public List<FitAnalysis> results;
        public int total;
        public int returned;
        public boolean fitsReady;
        public boolean softFitFallback;
        public Map<String, Object> filtersApplied;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BalancedRequest {
        @NotBlank
        public String userEmail;
        public String state;
        public List<String> excludeIds;
        public String sortBy;
    }

    public static class BalancedResponse {
        public boolean success;
        public List<FitAnalysis> safety;
        public List<FitAnalysis> target;
        public List<FitAnalysis> reach;
        public List<FitAnalysis> results;
        public boolean fitsReady;
    }

    public static class NeedsRecomputationResponse {
        public boolean success;
        public boolean needed;
        public String reason;
        public long currentVersion;
        public int staleCount;
        public int missingCount;

        public static NeedsRecomputationResponse from(RecomputationStatus s) {
            NeedsRecomputationResponse r = new NeedsRecomputationResponse();
            r.success = true;
            r.needed = s.needed();
            r.reason = s.reason();
            r.currentVersion = s.currentVersion();
            r.staleCount = s.staleCount();
            r.missingCount = s.missingCount();
            return r;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegenerateInfographicRequest {
        @NotBlank
        public String userEmail;
        @NotBlank
        public String universityId;
    }

    public static class RegenerateInfographicResponse {
        public boolean success;
        public String universityId;
        public String imageUrl;
        public Instant generatedAt;
        public int creditsRemaining;
    }
}
