package org.stockadvisor.analysis.model;

import java.math.BigDecimal;

public final class BollingerBands {
    private final BigDecimal upper;
    private final BigDecimal middle;
    private final BigDecimal lower;

    public BollingerBands(BigDecimal upper, BigDecimal middle, BigDecimal lower) {
        this.upper = upper;
        this.middle = middle;
        this.lower = lower;
    }

    public BigDecimal getUpper() { return upper; }
    public BigDecimal getMiddle() { return middle; }
    public BigDecimal getLower() { return lower; }

    @Override
    public String toString() {
        return "BollingerBands{upper=" + upper + ", middle=" + middle + ", lower=" + lower + "}";
    }
}
