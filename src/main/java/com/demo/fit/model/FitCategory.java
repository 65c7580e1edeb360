package com.demo.fit.model;

/**
 * Discrete admissions-likelihood label for a student/university pair.
 * Higher {@code favorability} means a more likely admit.
 */
public enum FitCategory {
    SUPER_REACH(0),
    REACH(1),
    TARGET(2),
    SAFETY(3);

    private final int favorability;

    FitCategory(int favorability) {
        this.favorability = favorability;
    }

    public int favorability() {
        return favorability;
    }

    /** Returns this category, or {@code cap} when this one is more favorable than the cap. */
    public FitCategory cappedAt(FitCategory cap) {
        if (cap == null) return this;
        return favorability > cap.favorability ? cap : this;
    }

    public static FitCategory parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        return FitCategory.valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT).replace('-', '_').replace(' ', '_'));
    }
}
