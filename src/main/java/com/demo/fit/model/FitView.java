package com.demo.fit.model;

/**
 * A fit row joined with its catalog entry. {@code record} is null for soft fits derived from selectivity alone.
 */
public record FitView(FitRecord record, UniversityRecord university, FitCategory category, boolean stale, boolean softFit) {

    public static FitView of(FitRecord record, UniversityRecord university, boolean stale) {
        return new FitView(record, university, record.fitCategory(), stale, false);
    }

    public static FitView soft(UniversityRecord university, FitCategory category) {
        return new FitView(null, university, category, false, true);
    }
}
