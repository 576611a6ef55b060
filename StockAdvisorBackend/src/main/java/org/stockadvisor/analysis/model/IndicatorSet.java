package org.stockadvisor.analysis.model;

import java.math.BigDecimal;

/**
 * Snapshot of the momentum and trend indicators for the latest bar of a series.
 *
 * Every field is nullable: each indicator has its own minimum history
 * (RSI needs period + 1 bars, MACD 26, the deviation rate its moving-average
 * period) and is left null when the series is too short.
 */
public final class IndicatorSet {
    private final BigDecimal rsi;
    private final BigDecimal sma;
    private final BigDecimal ema;
    private final MacdResult macd;
    private final BollingerBands bollinger;
    private final BigDecimal deviationRate;

    public IndicatorSet(BigDecimal rsi, BigDecimal sma, BigDecimal ema, MacdResult macd,
                        BollingerBands bollinger, BigDecimal deviationRate) {
        this.rsi = rsi;
        this.sma = sma;
        this.ema = ema;
        this.macd = macd;
        this.bollinger = bollinger;
        this.deviationRate = deviationRate;
    }

    public BigDecimal getRsi() { return rsi; }
    public BigDecimal getSma() { return sma; }
    public BigDecimal getEma() { return ema; }
    public MacdResult getMacd() { return macd; }
    public BollingerBands getBollinger() { return bollinger; }
    public BigDecimal getDeviationRate() { return deviationRate; }

    /**
     * Convenience accessor for the combiner, null when MACD could not be computed.
     */
    public BigDecimal getMacdHistogram() {
        return macd != null ? macd.getHistogram() : null;
    }

    @Override
    public String toString() {
        return "IndicatorSet{rsi=" + rsi + ", sma=" + sma + ", ema=" + ema + ", macd=" + macd +
            ", bollinger=" + bollinger + ", deviationRate=" + deviationRate + "}";
    }
}
