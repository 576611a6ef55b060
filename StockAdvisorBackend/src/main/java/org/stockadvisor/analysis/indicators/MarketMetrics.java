package org.stockadvisor.analysis.indicators;

import org.stockadvisor.analysis.model.PriceSeries;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Scalar metrics derived from a whole series, used as safety-rule inputs.
 */
public final class MarketMetrics {

    /** Trading days in a week; the week change compares against the close this many bars back. */
    public static final int WEEK_BARS = 5;

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private MarketMetrics() {
    }

    /**
     * Week-over-week change of the latest close, in percent.
     * Needs at least {@value #WEEK_BARS} bars; with exactly five the oldest bar is the reference.
     * @return rate, or null if insufficient data or a zero reference close
     */
    public static BigDecimal weekChangeRate(PriceSeries series) {
        if (series.size() < WEEK_BARS) {
            return null;
        }
        BigDecimal latest = series.latest().getClose();
        BigDecimal weekAgo = series.get(Math.max(0, series.size() - WEEK_BARS - 1)).getClose();
        if (weekAgo.signum() == 0) {
            return null;
        }
        return TechnicalIndicators.round(latest.subtract(weekAgo)
            .divide(weekAgo, TechnicalIndicators.SCALE, RoundingMode.HALF_UP)
            .multiply(HUNDRED));
    }

    /**
     * Coefficient of variation of all closes (population standard deviation over mean), in percent.
     * @return volatility, or null for fewer than two bars or a zero mean
     */
    public static BigDecimal volatility(PriceSeries series) {
        if (series.size() < 2) {
            return null;
        }
        List<BigDecimal> closes = series.closes();
        BigDecimal mean = TechnicalIndicators.sum(closes)
            .divide(BigDecimal.valueOf(closes.size()), TechnicalIndicators.SCALE, RoundingMode.HALF_UP);
        if (mean.signum() == 0) {
            return null;
        }
        BigDecimal stdDev = TechnicalIndicators.calculateStandardDeviation(closes, closes.size());
        return TechnicalIndicators.round(stdDev
            .divide(mean, TechnicalIndicators.SCALE, RoundingMode.HALF_UP)
            .multiply(HUNDRED));
    }
}
