package org.stockadvisor.analysis.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Direction and strength (0-100) merged from candlestick, RSI and MACD, with
 * the human-readable reasons behind it.
 */
public final class CombinedSignal {
    private final Signal signal;
    private final int strength;
    private final List<String> reasons;

    public CombinedSignal(Signal signal, int strength, List<String> reasons) {
        this.signal = Objects.requireNonNull(signal, "signal");
        this.strength = strength;
        this.reasons = List.copyOf(reasons);
    }

    public Signal getSignal() { return signal; }
    public int getStrength() { return strength; }
    public List<String> getReasons() { return Collections.unmodifiableList(reasons); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CombinedSignal)) return false;
        CombinedSignal that = (CombinedSignal) o;
        return strength == that.strength && signal == that.signal && reasons.equals(that.reasons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signal, strength, reasons);
    }

    @Override
    public String toString() {
        return "CombinedSignal{signal=" + signal.getValue() + ", strength=" + strength + ", reasons=" + reasons + "}";
    }
}
