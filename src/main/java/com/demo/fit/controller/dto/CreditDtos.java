package com.demo.fit.controller.dto;

import com.demo.fit.model.CreditAccount;
import com.demo.fit.model.CreditHistoryEntry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;
import java.util.List;

public final class CreditDtos {

    private CreditDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CheckRequest {
        @NotBlank
        public String userEmail;
        public Integer creditsNeeded;   // default 1
    }

    public static class CheckResponse {
        public boolean hasCredits;
        public int creditsRemaining;
        public String tier;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DeductRequest {
        @NotBlank
        public String userEmail;
        public Integer creditCount;
        public String reason;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AddRequest {
        @NotBlank
        public String userEmail;
        public Integer creditCount;
        public String source;
    }

    public static class BalanceResponse {
        public boolean success;
        public int creditsRemaining;

        public static BalanceResponse of(int remaining) {
            BalanceResponse r = new BalanceResponse();
            r.success = true;
            r.creditsRemaining = remaining;
            return r;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UpgradeRequest {
        @NotBlank
        public String userEmail;
        public String tier;                 // free | pro, default pro
        public String plan;                 // monthly | season_pass
        public Instant subscriptionExpires; // default: plan length from now
    }

    public static class AccountResponse {
        public boolean success;
        public String userId;
        public String tier;
        public int creditsTotal;
        public int creditsUsed;
        public int creditsRemaining;
        public boolean subscriptionActive;
        public String subscriptionPlan;
        public Instant subscriptionExpires;
        public List<HistoryEntry> history;

        public static AccountResponse from(CreditAccount a, List<CreditHistoryEntry> history) {
            AccountResponse r = new AccountResponse();
            r.success = true;
            r.userId = a.userId();
            r.tier = a.tier().code();
            r.creditsTotal = a.creditsTotal();
            r.creditsUsed = a.creditsUsed();
            r.creditsRemaining = a.creditsRemaining();
            r.subscriptionActive = a.subscriptionActive();
            r.subscriptionPlan = a.subscriptionPlan();
            r.subscriptionExpires = a.subscriptionExpires();
            r.history = history == null ? List.of() : history.stream().map(HistoryEntry::from).toList();
            return r;
        }
    }

    public static class HistoryEntry {
        public int amount;
        public String reason;
        public int balanceAfter;
        public Instant createdAt;

        static HistoryEntry from(CreditHistoryEntry e) {
            HistoryEntry h = new HistoryEntry();
            h.amount = e.amount();
            h.reason = e.reason();
            h.balanceAfter = e.balanceAfter();
            h.createdAt = e.createdAt();
            return h;
        }
    }
}
