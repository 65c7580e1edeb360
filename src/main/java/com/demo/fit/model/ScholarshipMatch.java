package com.demo.fit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScholarshipMatch(
        String name,
        String amount,
        String deadline,
        String matchReason,
        String applicationMethod
) {}
