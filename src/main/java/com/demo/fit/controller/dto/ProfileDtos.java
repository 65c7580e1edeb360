package com.demo.fit.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

public final class ProfileDtos {

    private ProfileDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileChangedRequest {
        @NotBlank
        public String userEmail;
        public JsonNode profile;   // academic stats, activities, intended major...
    }

    public static class ProfileChangedResponse {
        public boolean success;
        public long profileVersion;
        public boolean needsRecomputation;
        public String reason;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResetRequest {
        @NotBlank
        public String userEmail;
    }

    public static class ResetResponse {
        public boolean success;
        public String message;
    }
}
