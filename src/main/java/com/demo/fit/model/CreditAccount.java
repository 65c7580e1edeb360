package com.demo.fit.model;

import java.time.Instant;

public record CreditAccount(
        String userId,
        Tier tier,
        int creditsTotal,
        int creditsUsed,
        int creditsRemaining,
        boolean subscriptionActive,
        String subscriptionPlan,
        Instant subscriptionExpires,
        Instant createdAt,
        Instant updatedAt
) {}
