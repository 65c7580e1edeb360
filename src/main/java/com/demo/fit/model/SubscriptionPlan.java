package com.demo.fit.model;

import java.time.Duration;
import java.util.Locale;

/** Paid plans; each grants a credit bundle and lasts a default period when no expiry is supplied. */
public enum SubscriptionPlan {
    MONTHLY("monthly", Duration.ofDays(30)),
    SEASON_PASS("season_pass", Duration.ofDays(180));

    private final String code;
    private final Duration defaultLength;

    SubscriptionPlan(String code, Duration defaultLength) {
        this.code = code;
        this.defaultLength = defaultLength;
    }

    public String code() {
        return code;
    }

    public Duration defaultLength() {
        return defaultLength;
    }

    public static SubscriptionPlan parse(String raw) {
        if (raw == null || raw.isBlank()) return MONTHLY;
        String k = raw.trim().toLowerCase(Locale.ROOT);
        for (SubscriptionPlan p : values()) {
            if (p.code.equals(k)) return p;
        }
        throw new IllegalArgumentException("Unknown plan: " + raw);
    }
}
