package org.stockadvisor.analysis.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A detected chart formation.
 *
 * Signal, rank and reference win rate come from the {@link ChartPatternType};
 * strength, confidence, texts and the index span are produced by the detector.
 * Indices refer to the oldest-first series the detector was run on.
 */
public final class ChartPatternMatch {
    private final ChartPatternType pattern;
    private final Signal signal;
    private final PatternRank rank;
    private final int referenceWinRate;
    private final int strength;
    private final BigDecimal confidence;
    private final String description;
    private final String explanation;
    private final int startIndex;
    private final int endIndex;

    public ChartPatternMatch(ChartPatternType pattern, int strength, BigDecimal confidence,
                             String description, String explanation, int startIndex, int endIndex) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.signal = pattern.getSignal();
        this.rank = pattern.getRank();
        this.referenceWinRate = pattern.getReferenceWinRate();
        this.strength = strength;
        this.confidence = confidence;
        this.description = description;
        this.explanation = explanation;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
    }

    public ChartPatternType getPattern() { return pattern; }
    public String getPatternName() { return pattern.getDisplayName(); }
    public Signal getSignal() { return signal; }
    public PatternRank getRank() { return rank; }
    public int getReferenceWinRate() { return referenceWinRate; }
    public int getStrength() { return strength; }
    public BigDecimal getConfidence() { return confidence; }
    public String getDescription() { return description; }
    public String getExplanation() { return explanation; }
    public int getStartIndex() { return startIndex; }
    public int getEndIndex() { return endIndex; }

    /**
     * Ranking key used to order matches: strength weighted by confidence.
     */
    public BigDecimal getScore() {
        return confidence.multiply(BigDecimal.valueOf(strength));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChartPatternMatch)) return false;
        ChartPatternMatch that = (ChartPatternMatch) o;
        return pattern == that.pattern && strength == that.strength &&
            confidence.compareTo(that.confidence) == 0 &&
            startIndex == that.startIndex && endIndex == that.endIndex &&
            description.equals(that.description) && explanation.equals(that.explanation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, strength, startIndex, endIndex, description);
    }

    @Override
    public String toString() {
        return String.format("ChartPatternMatch{pattern=%s, signal=%s, rank=%s, strength=%d, confidence=%s, span=%d..%d}",
            pattern.getId(), signal.getValue(), rank, strength, confidence, startIndex, endIndex);
    }
}
