package com.demo.fit.service.dto;

import com.demo.fit.model.ApplicationTimeline;
import com.demo.fit.model.EssayAngle;
import com.demo.fit.model.FitFactor;
import com.demo.fit.model.GapAnalysis;
import com.demo.fit.model.Recommendation;
import com.demo.fit.model.ScholarshipMatch;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.List;

/**
 * Payload returned by the factor evaluator. Any category or percentage the evaluator suggests is
 * ignored; only the factors and the narrative artifacts are used.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EvaluationResult {
    private List<FitFactor> factors;
    private String explanation;
    private GapAnalysis gapAnalysis;
    private List<Recommendation> recommendations;
    private List<EssayAngle> essayAngles;
    private List<ScholarshipMatch> scholarshipMatches;
    private ApplicationTimeline applicationTimeline;
    private JsonNode testStrategy;
    private JsonNode majorStrategy;
    private List<String> demonstratedInterestTips;
    private List<String> redFlagsToAvoid;
}
