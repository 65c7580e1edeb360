package com.demo.fit.model;

/** Baseline selectivity of an institution, derived from its acceptance rate. */
public enum SelectivityTier {
    ULTRA_SELECTIVE,
    HIGHLY_SELECTIVE,
    VERY_SELECTIVE,
    SELECTIVE,
    ACCESSIBLE
}
