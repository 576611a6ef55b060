package org.stockadvisor.analysis.indicators;

import java.math.BigDecimal;

import static org.stockadvisor.analysis.indicators.IndicatorThresholds.*;

/**
 * Maps raw indicator values onto named zones so downstream text and policy
 * code does not have to repeat the threshold comparisons.
 */
public final class IndicatorInterpretation {

    private IndicatorInterpretation() {
    }

    public enum RsiZone { OVERSOLD, WEAK_OVERSOLD, NORMAL, WEAK_OVERBOUGHT, OVERBOUGHT }

    public enum MacdTrend { STRONG_UP, UP, FLAT, DOWN, STRONG_DOWN }

    public enum DeviationZone { OVERHEATED, STABLE, NORMAL, OVERSOLD }

    /**
     * @return the zone, or null when RSI is unavailable
     */
    public static RsiZone rsiZone(BigDecimal rsi) {
        if (rsi == null) return null;
        if (rsi.compareTo(RSI_OVERSOLD) <= 0) return RsiZone.OVERSOLD;
        if (rsi.compareTo(RSI_WEAK_OVERSOLD) <= 0) return RsiZone.WEAK_OVERSOLD;
        if (rsi.compareTo(RSI_OVERBOUGHT) >= 0) return RsiZone.OVERBOUGHT;
        if (rsi.compareTo(RSI_WEAK_OVERBOUGHT) >= 0) return RsiZone.WEAK_OVERBOUGHT;
        return RsiZone.NORMAL;
    }

    /**
     * @return the trend, or null when the histogram is unavailable
     */
    public static MacdTrend macdTrend(BigDecimal histogram) {
        if (histogram == null) return null;
        if (histogram.compareTo(MACD_STRONG_MOMENTUM) > 0) return MacdTrend.STRONG_UP;
        if (histogram.signum() > 0) return MacdTrend.UP;
        if (histogram.compareTo(MACD_STRONG_MOMENTUM.negate()) < 0) return MacdTrend.STRONG_DOWN;
        if (histogram.signum() < 0) return MacdTrend.DOWN;
        return MacdTrend.FLAT;
    }

    /**
     * @return the zone, or null when the deviation rate is unavailable
     */
    public static DeviationZone deviationZone(BigDecimal deviationRate) {
        if (deviationRate == null) return null;
        if (deviationRate.compareTo(DEVIATION_UPPER) >= 0) return DeviationZone.OVERHEATED;
        if (deviationRate.compareTo(DEVIATION_LOWER) <= 0) return DeviationZone.OVERSOLD;
        if (deviationRate.abs().compareTo(DEVIATION_STABLE_BAND) <= 0) return DeviationZone.STABLE;
        return DeviationZone.NORMAL;
    }
}
