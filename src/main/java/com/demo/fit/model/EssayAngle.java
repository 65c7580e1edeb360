package com.demo.fit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EssayAngle(
        String essayPrompt,
        String angle,
        String studentHook,
        String schoolHook,
        Integer wordLimit,
        String tip
) {}
