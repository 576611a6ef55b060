package org.stockadvisor.analysis.model;

import java.util.Objects;

/**
 * Classification of one bar: pattern, direction, strength (0-100) and the
 * plain-language texts that go with it.
 */
public final class CandlestickPattern {
    private final CandlestickPatternType pattern;
    private final Signal signal;
    private final int strength;
    private final String description;
    private final String explanation;

    public CandlestickPattern(CandlestickPatternType pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.signal = pattern.getSignal();
        this.strength = pattern.getStrength();
        this.description = pattern.getDescription();
        this.explanation = pattern.getExplanation();
    }

    public CandlestickPatternType getPattern() { return pattern; }
    public Signal getSignal() { return signal; }
    public int getStrength() { return strength; }
    public String getDescription() { return description; }
    public String getExplanation() { return explanation; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CandlestickPattern)) return false;
        return pattern == ((CandlestickPattern) o).pattern;
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return String.format("CandlestickPattern{pattern=%s, signal=%s, strength=%d}", pattern.getId(), signal.getValue(), strength);
    }
}
