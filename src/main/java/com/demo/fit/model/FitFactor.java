package com.demo.fit.model;

/**
 * A named sub-score. {@code max <= 0} marks a display-only factor that does not count toward the match percentage.
 */
public record FitFactor(
        String name,
        double score,
        double max,
        String detail
) {
    public boolean scoring() {
        return max > 0;
    }

    public FitFactor rebasedTo(double newMax) {
        if (max <= 0 || newMax == max) return this;
        double rebased = Math.round(score * newMax / max * 10.0) / 10.0;
        return new FitFactor(name, rebased, newMax, detail);
    }
}
