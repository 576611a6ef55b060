package org.stockadvisor.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Multi-bar chart formations known to the detector registry.
 *
 * The reference win rate is a fixed figure cited from Bulkowski's
 * "Encyclopedia of Chart Patterns". It documents how the pattern has
 * performed historically in general and is never computed from, or
 * calibrated against, the series being analysed.
 */
public enum ChartPatternType {

    INVERSE_HEAD_AND_SHOULDERS("inverse_head_and_shoulders", "Inverse Head and Shoulders", Signal.BUY, PatternRank.S, 89),
    DOUBLE_BOTTOM("double_bottom", "Double Bottom", Signal.BUY, PatternRank.S, 88),
    TRIPLE_BOTTOM("triple_bottom", "Triple Bottom", Signal.BUY, PatternRank.A, 87),
    ASCENDING_TRIANGLE("ascending_triangle", "Ascending Triangle", Signal.BUY, PatternRank.A, 83),
    BULL_FLAG("bull_flag", "Bull Flag", Signal.BUY, PatternRank.C, 54),

    HEAD_AND_SHOULDERS("head_and_shoulders", "Head and Shoulders", Signal.SELL, PatternRank.S, 89),
    DESCENDING_TRIANGLE("descending_triangle", "Descending Triangle", Signal.SELL, PatternRank.S, 87),
    DOUBLE_TOP("double_top", "Double Top", Signal.SELL, PatternRank.B, 73),
    BEAR_FLAG("bear_flag", "Bear Flag", Signal.SELL, PatternRank.C, 54),

    BOX_RANGE("box_range", "Box Range", Signal.NEUTRAL, PatternRank.D, 55),
    SYMMETRICAL_TRIANGLE("symmetrical_triangle", "Symmetrical Triangle", Signal.NEUTRAL, PatternRank.D, 55);

    private final String id;
    private final String displayName;
    private final Signal signal;
    private final PatternRank rank;
    private final int referenceWinRate;

    ChartPatternType(String id, String displayName, Signal signal, PatternRank rank, int referenceWinRate) {
        this.id = id;
        this.displayName = displayName;
        this.signal = signal;
        this.rank = rank;
        this.referenceWinRate = referenceWinRate;
    }

    @JsonValue
    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public Signal getSignal() { return signal; }
    public PatternRank getRank() { return rank; }
    public int getReferenceWinRate() { return referenceWinRate; }
}
