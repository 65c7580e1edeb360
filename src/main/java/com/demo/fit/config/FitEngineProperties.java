package com.demo.fit.config;

import com.demo.fit.model.FitCategory;
import com.demo.fit.model.SelectivityTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Engine tunables, bound from the {@code fit.*} keys of application.yml.
 */
@ConfigurationProperties(prefix = "fit")
public record FitEngineProperties(
        Scoring scoring,
        Batch batch,
        Compute compute,
        Credits credits,
        Evaluator evaluator,
        Query query
) {

    /**
     * Percentage bands and selectivity caps.
     *
     * @param safetyThreshold       a percentage strictly above this is SAFETY
     * @param targetThreshold       a percentage strictly above this is TARGET
     * @param reachThreshold        a percentage strictly above this is REACH, otherwise SUPER_REACH
     * @param defaultAcceptanceRate used when a catalog entry has no acceptance rate
     */
    public record Scoring(
            int safetyThreshold,
            int targetThreshold,
            int reachThreshold,
            double defaultAcceptanceRate,
            Selectivity selectivity
    ) {}

    /**
     * Acceptance-rate cut-offs (exclusive upper bounds, in percent) and the most favorable category each tier allows.
     */
    public record Selectivity(
            double ultraSelectiveBelow,
            double highlySelectiveBelow,
            double verySelectiveBelow,
            double selectiveBelow,
            Map<SelectivityTier, FitCategory> caps
    ) {}

    /**
     * @param size             universities evaluated concurrently per batch
     * @param evaluatorRetries extra attempts after an evaluator failure
     * @param retryDelay       pause before a retry
     */
    public record Batch(int size, int evaluatorRetries, Duration retryDelay) {}

    /**
     * @param waitTimeout   how long a caller waits for a computation before giving up on its own wait
     * @param poolSize      threads running evaluator calls
     * @param batchPoolSize threads fanning out batch requests
     */
    public record Compute(Duration waitTimeout, int poolSize, int batchPoolSize) {}

    public record Credits(
            int freeTierCredits,
            int monthlyPlanCredits,
            int seasonPassCredits,
            int recomputeCost,
            int infographicCost
    ) {}

    /**
     * @param approach  key into {@code endpoints}; resolved once at startup
     * @param endpoints base URL per knowledge-base approach (rag, elasticsearch, firestore, hybrid, vertexai)
     */
    public record Evaluator(
            String approach,
            Map<String, String> endpoints,
            Duration connectTimeout,
            Duration readTimeout,
            String infographicUrl
    ) {}

    public record Query(int defaultLimit, int maxLimit, Balanced balanced) {}

    public record Balanced(int safety, int target, int reach) {}
}
