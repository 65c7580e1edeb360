package com.demo.fit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GapAnalysis(
        String primaryGap,
        String secondaryGap,
        List<String> studentStrengths
) {
    public static GapAnalysis empty() {
        return new GapAnalysis(null, null, List.of());
    }
}
