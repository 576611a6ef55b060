package org.stockadvisor.analysis.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * MACD line, signal line and histogram, each rounded to two decimals.
 * The histogram is derived from the two rounded lines, never stored on its own.
 */
public final class MacdResult {
    private final BigDecimal macd;
    private final BigDecimal signal;

    public MacdResult(BigDecimal macd, BigDecimal signal) {
        this.macd = Objects.requireNonNull(macd, "macd");
        this.signal = Objects.requireNonNull(signal, "signal");
    }

    public BigDecimal getMacd() { return macd; }
    public BigDecimal getSignal() { return signal; }

    public BigDecimal getHistogram() {
        return macd.subtract(signal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MacdResult)) return false;
        MacdResult that = (MacdResult) o;
        return macd.compareTo(that.macd) == 0 && signal.compareTo(that.signal) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(macd.stripTrailingZeros(), signal.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "MacdResult{macd=" + macd + ", signal=" + signal + ", histogram=" + getHistogram() + "}";
    }
}
