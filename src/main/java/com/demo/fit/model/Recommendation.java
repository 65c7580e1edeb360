package com.demo.fit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Recommendation(
        String action,
        String addressesGap,
        String schoolSpecificContext,
        String timeline,
        String impact
) {}
