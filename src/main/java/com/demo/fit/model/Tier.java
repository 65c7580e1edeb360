package com.demo.fit.model;

public enum Tier {
    FREE,
    PRO;

    public String code() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }

    public static Tier parse(String raw) {
        return raw == null ? FREE : Tier.valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
