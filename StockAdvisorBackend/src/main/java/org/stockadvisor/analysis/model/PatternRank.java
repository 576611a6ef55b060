package org.stockadvisor.analysis.model;

/**
 * Literature-derived reliability tier of a chart pattern.
 * Tiers follow published win-rate studies, not this system's own data.
 */
public enum PatternRank {
    /** Reference win rate of 85% or more. */
    S,
    /** 80-85%. */
    A,
    /** 65-80%. */
    B,
    /** 50-65%. */
    C,
    /** Around 50%, no directional edge. */
    D
}
