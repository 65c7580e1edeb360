package com.demo.fit.model;

import java.time.Instant;

/** One ledger movement. Negative {@code amount} is a deduction, positive an addition. */
public record CreditHistoryEntry(
        long id,
        String userId,
        int amount,
        String reason,
        int balanceAfter,
        Instant createdAt
) {}
