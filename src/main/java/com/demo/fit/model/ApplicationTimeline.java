package com.demo.fit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Recommended application plan (ED/EA/RD) with its deadline and preparation milestones. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApplicationTimeline(
        String recommendedPlan,
        String deadline,
        Boolean isBinding,
        String rationale,
        String financialAidDeadline,
        List<String> keyMilestones
) {}
