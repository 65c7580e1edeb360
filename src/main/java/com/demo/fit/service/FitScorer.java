package com.demo.fit.service;

import com.demo.fit.config.FitEngineProperties;
import com.demo.fit.model.FitCategory;
import com.demo.fit.model.FitFactor;
import com.demo.fit.model.SelectivityTier;
import com.demo.fit.model.UniversityRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Factor scores to match percentage to fit category. Pure and deterministic.
 * <p>
 * The percentage reflects the student's profile only. The institution's selectivity never changes the
 * number; it only caps how favorable the category label may be.
 */
@Component
public class FitScorer {

    public static final String SELECTIVITY_CONTEXT = "Selectivity Context";

    /** Fixed point ceiling per scoring factor. */
    public static final Map<String, Integer> FACTOR_WEIGHTS;

    static {
        Map<String, Integer> w = new LinkedHashMap<>();
        w.put("GPA Match", 40);
        w.put("Test Scores", 25);
        w.put("Course Rigor", 20);
        w.put("Major Fit", 15);
        w.put("Activities", 15);
        w.put("Early Action", 10);
        FACTOR_WEIGHTS = Collections.unmodifiableMap(w);
    }

    private final FitEngineProperties.Scoring scoring;

    public FitScorer(FitEngineProperties properties) {
        this.scoring = properties.scoring();
    }

    public Score score(List<FitFactor> rawFactors, UniversityRecord university) {
        SelectivityTier tier = selectivityOf(university.acceptanceRate());
        List<FitFactor> factors = normalizeFactors(rawFactors, university, tier);
        int pct = matchPercentage(factors);
        return new Score(pct, categorize(pct, tier), tier, factors);
    }

    /** round(100 * sum(score) / sum(max)) over factors with a positive max, clamped to [0, 100]. */
    public int matchPercentage(List<FitFactor> factors) {
        double sum = 0;
        double max = 0;
        for (FitFactor f : factors) {
            if (!f.scoring()) continue;
            sum += f.score();
            max += f.max();
        }
        if (max <= 0) return 0;
        long pct = Math.round(100.0 * sum / max);
        return (int) Math.max(0, Math.min(100, pct));
    }

    /** Band lookup; a percentage sitting exactly on a boundary takes the less favorable band. */
    public FitCategory baseCategory(int matchPercentage) {
        if (matchPercentage > scoring.safetyThreshold()) return FitCategory.SAFETY;
        if (matchPercentage > scoring.targetThreshold()) return FitCategory.TARGET;
        if (matchPercentage > scoring.reachThreshold()) return FitCategory.REACH;
        return FitCategory.SUPER_REACH;
    }

    public FitCategory categorize(int matchPercentage, SelectivityTier tier) {
        return baseCategory(matchPercentage).cappedAt(capFor(tier));
    }

    public FitCategory capFor(SelectivityTier tier) {
        var caps = scoring.selectivity().caps();
        return caps == null ? null : caps.get(tier);
    }

    public SelectivityTier selectivityOf(Double acceptanceRate) {
        double rate = effectiveRate(acceptanceRate);
        var s = scoring.selectivity();
        if (rate < s.ultraSelectiveBelow()) return SelectivityTier.ULTRA_SELECTIVE;
        if (rate < s.highlySelectiveBelow()) return SelectivityTier.HIGHLY_SELECTIVE;
        if (rate < s.verySelectiveBelow()) return SelectivityTier.VERY_SELECTIVE;
        if (rate < s.selectiveBelow()) return SelectivityTier.SELECTIVE;
        return SelectivityTier.ACCESSIBLE;
    }

    /**
     * Category from selectivity alone, used when no personalized fit exists yet.
     */
    public FitCategory softCategory(Double acceptanceRate) {
        return switch (selectivityOf(acceptanceRate)) {
            case ULTRA_SELECTIVE -> FitCategory.SUPER_REACH;
            case HIGHLY_SELECTIVE -> FitCategory.REACH;
            case VERY_SELECTIVE, SELECTIVE -> FitCategory.TARGET;
            case ACCESSIBLE -> FitCategory.SAFETY;
        };
    }

    /**
     * Re-bases known factors onto their fixed weight, drops duplicate names (first wins) and appends a
     * display-only selectivity factor when the evaluator did not send one.
     */
    List<FitFactor> normalizeFactors(List<FitFactor> raw, UniversityRecord university, SelectivityTier tier) {
        List<FitFactor> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        boolean hasContext = false;
        if (raw != null) {
            for (FitFactor f : raw) {
                if (f == null || f.name() == null) continue;
                if (!seen.add(f.name().toLowerCase(Locale.ROOT))) continue;
                if (SELECTIVITY_CONTEXT.equalsIgnoreCase(f.name())) {
                    out.add(new FitFactor(SELECTIVITY_CONTEXT, 0, 0, f.detail()));
                    hasContext = true;
                    continue;
                }
                Integer weight = FACTOR_WEIGHTS.get(f.name());
                out.add(weight == null ? f : f.rebasedTo(weight));
            }
        }
        if (!hasContext) {
            out.add(new FitFactor(SELECTIVITY_CONTEXT, 0, 0, selectivityDetail(university, tier)));
        }
        return out;
    }

    private String selectivityDetail(UniversityRecord university, SelectivityTier tier) {
        Double rate = university.acceptanceRate();
        String shown = rate == null ? "unknown" : String.format(Locale.ROOT, "%.1f%%", rate);
        return shown + " acceptance rate (" + tier.name().replace('_', ' ').toLowerCase(Locale.ROOT) + ")";
    }

    private double effectiveRate(Double acceptanceRate) {
        return acceptanceRate == null ? scoring.defaultAcceptanceRate() : acceptanceRate;
    }

    public record Score(int matchPercentage, FitCategory category, SelectivityTier tier, List<FitFactor> factors) {}
}
