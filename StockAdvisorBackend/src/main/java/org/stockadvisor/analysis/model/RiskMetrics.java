package org.stockadvisor.analysis.model;

import java.math.BigDecimal;

/**
 * Scalar inputs to the safety rules. All fields are nullable; a missing
 * metric never raises a flag.
 */
public final class RiskMetrics {
    private final BigDecimal weekChangeRate;
    private final BigDecimal volatility;
    private final BigDecimal deviationRate;
    private final Boolean profitable;

    public RiskMetrics(BigDecimal weekChangeRate, BigDecimal volatility, BigDecimal deviationRate, Boolean profitable) {
        this.weekChangeRate = weekChangeRate;
        this.volatility = volatility;
        this.deviationRate = deviationRate;
        this.profitable = profitable;
    }

    /** Percent change of the latest close against the close five bars earlier. */
    public BigDecimal getWeekChangeRate() { return weekChangeRate; }
    /** Standard deviation of closes as a percent of their mean. */
    public BigDecimal getVolatility() { return volatility; }
    /** Percent distance of the latest close from its moving average. */
    public BigDecimal getDeviationRate() { return deviationRate; }
    /** Whether the company is profitable, null when unknown. */
    public Boolean getProfitable() { return profitable; }

    @Override
    public String toString() {
        return "RiskMetrics{weekChangeRate=" + weekChangeRate + ", volatility=" + volatility +
            ", deviationRate=" + deviationRate + ", profitable=" + profitable + "}";
    }
}
