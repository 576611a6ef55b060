package org.stockadvisor.analysis.indicators;

import org.stockadvisor.analysis.model.BollingerBands;
import org.stockadvisor.analysis.model.IndicatorSet;
import org.stockadvisor.analysis.model.MacdResult;
import org.stockadvisor.analysis.model.PriceSeries;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Technical Indicators Calculator
 * Momentum and trend indicators over a list of closing prices
 *
 * All price lists are oldest first: index 0 is the oldest close and the last
 * element is the latest one. Every public result is rounded to two decimals;
 * intermediate values keep {@value #SCALE} decimals.
 *
 * Insufficient history is reported as null rather than an exception.
 *
 * This class is stateless and thread-safe - all methods are static
 */
public class TechnicalIndicators {

    public static final int DEFAULT_RSI_PERIOD = 14;
    public static final int DEFAULT_MA_PERIOD = 25;
    public static final int MACD_FAST_PERIOD = 12;
    public static final int MACD_SLOW_PERIOD = 26;
    public static final int MACD_SIGNAL_PERIOD = 9;
    public static final int DEFAULT_BOLLINGER_PERIOD = 20;
    public static final BigDecimal DEFAULT_BOLLINGER_MULTIPLIER = new BigDecimal("2");

    static final int SCALE = 8;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private TechnicalIndicators() {
        // Utility class - prevent instantiation
    }

    // ==================== Moving Averages ====================

    /**
     * Calculate Simple Moving Average (SMA) of the last {@code period} closes
     * @param prices List of prices, oldest first
     * @param period Number of periods
     * @return SMA value, or null if insufficient data
     */
    public static BigDecimal calculateSMA(List<BigDecimal> prices, int period) {
        BigDecimal sma = sma(prices, period);
        return sma != null ? round(sma) : null;
    }

    /**
     * Calculate Exponential Moving Average (EMA)
     * Seeded with the SMA of the oldest {@code period} closes, then rolled forward
     * to the latest close with k = 2 / (period + 1).
     * @param prices List of prices, oldest first
     * @param period Number of periods
     * @return EMA value, or null if insufficient data
     */
    public static BigDecimal calculateEMA(List<BigDecimal> prices, int period) {
        List<BigDecimal> series = emaSeries(prices, period);
        return series.isEmpty() ? null : round(series.get(series.size() - 1));
    }

    // ==================== Momentum Indicators ====================

    /**
     * Calculate Relative Strength Index (RSI)
     * Simple average of gains and losses over the last {@code period} price changes.
     * @param prices List of prices, oldest first
     * @param period Number of periods (typically 14)
     * @return RSI value (0-100), exactly 100 when there were no losses, or null if insufficient data
     */
    public static BigDecimal calculateRSI(List<BigDecimal> prices, int period) {
        requirePositive(period);
        if (prices == null || prices.size() < period + 1) {
            return null;
        }

        BigDecimal gains = BigDecimal.ZERO;
        BigDecimal losses = BigDecimal.ZERO;

        int first = prices.size() - period;
        for (int i = first; i < prices.size(); i++) {
            BigDecimal change = prices.get(i).subtract(prices.get(i - 1));
            if (change.signum() > 0) {
                gains = gains.add(change);
            } else {
                losses = losses.add(change.abs());
            }
        }

        BigDecimal avgGain = gains.divide(BigDecimal.valueOf(period), SCALE, RoundingMode.HALF_UP);
        BigDecimal avgLoss = losses.divide(BigDecimal.valueOf(period), SCALE, RoundingMode.HALF_UP);

        if (avgLoss.signum() == 0) {
            return round(HUNDRED);
        }

        // RSI = 100 - (100 / (1 + RS))
        BigDecimal rs = avgGain.divide(avgLoss, SCALE, RoundingMode.HALF_UP);
        return round(HUNDRED.subtract(
            HUNDRED.divide(BigDecimal.ONE.add(rs), SCALE, RoundingMode.HALF_UP)
        ));
    }

    /**
     * Calculate Moving Average Convergence Divergence (MACD) with the 12/26/9 defaults
     *
     * The MACD line is tracked at every bar from the 26th onwards and the
     * signal line is the 9-period EMA of that whole history. With fewer than
     * nine MACD values the signal falls back to their mean.
     *
     * @param prices List of prices, oldest first
     * @return MACD line and signal line, or null with fewer than 26 prices
     */
    public static MacdResult calculateMACD(List<BigDecimal> prices) {
        if (prices == null || prices.size() < MACD_SLOW_PERIOD) {
            return null;
        }

        List<BigDecimal> fast = emaSeries(prices, MACD_FAST_PERIOD);
        List<BigDecimal> slow = emaSeries(prices, MACD_SLOW_PERIOD);

        // fast.get(j) is the EMA at price index j + 11, slow.get(j) at j + 25
        int offset = MACD_SLOW_PERIOD - MACD_FAST_PERIOD;
        List<BigDecimal> macdHistory = new ArrayList<>(slow.size());
        for (int j = 0; j < slow.size(); j++) {
            macdHistory.add(fast.get(j + offset).subtract(slow.get(j)));
        }

        BigDecimal macd = macdHistory.get(macdHistory.size() - 1);
        BigDecimal signal;
        if (macdHistory.size() >= MACD_SIGNAL_PERIOD) {
            List<BigDecimal> signalSeries = emaSeries(macdHistory, MACD_SIGNAL_PERIOD);
            signal = signalSeries.get(signalSeries.size() - 1);
        } else {
            signal = sum(macdHistory).divide(BigDecimal.valueOf(macdHistory.size()), SCALE, RoundingMode.HALF_UP);
        }

        return new MacdResult(round(macd), round(signal));
    }

    // ==================== Volatility Indicators ====================

    /**
     * Calculate population standard deviation of the last {@code period} closes
     * @return standard deviation (unrounded), or null if insufficient data
     */
    static BigDecimal calculateStandardDeviation(List<BigDecimal> prices, int period) {
        BigDecimal mean = sma(prices, period);
        if (mean == null) {
            return null;
        }

        BigDecimal sumSquaredDiff = BigDecimal.ZERO;
        for (int i = prices.size() - period; i < prices.size(); i++) {
            BigDecimal diff = prices.get(i).subtract(mean);
            sumSquaredDiff = sumSquaredDiff.add(diff.multiply(diff));
        }

        BigDecimal variance = sumSquaredDiff.divide(BigDecimal.valueOf(period), SCALE, RoundingMode.HALF_UP);
        return variance.sqrt(MathContext.DECIMAL64);
    }

    /**
     * Calculate Bollinger Bands
     * Middle band is the SMA; the outer bands sit {@code multiplier} population
     * standard deviations away from it.
     * @return the three bands, or null if insufficient data
     */
    public static BollingerBands calculateBollingerBands(List<BigDecimal> prices, int period,
                                                         BigDecimal multiplier) {
        BigDecimal middle = sma(prices, period);
        if (middle == null) {
            return null;
        }
        BigDecimal width = calculateStandardDeviation(prices, period).multiply(multiplier);

        return new BollingerBands(
            round(middle.add(width)),
            round(middle),
            round(middle.subtract(width))
        );
    }

    /**
     * Moving-average deviation rate: how far (in percent) the latest close sits
     * above or below its SMA. Compare against {@link IndicatorThresholds#DEVIATION_UPPER}
     * and {@link IndicatorThresholds#DEVIATION_LOWER}.
     * @return deviation in percent, or null if insufficient data or a zero average
     */
    public static BigDecimal calculateDeviationRate(List<BigDecimal> prices, int period) {
        BigDecimal sma = sma(prices, period);
        if (sma == null || sma.signum() == 0) {
            return null;
        }
        BigDecimal latest = prices.get(prices.size() - 1);
        return round(latest.subtract(sma)
            .divide(sma, SCALE, RoundingMode.HALF_UP)
            .multiply(HUNDRED));
    }

    // ==================== Snapshot ====================

    /**
     * Compute every indicator for the latest bar of a series with default periods:
     * RSI 14, SMA/EMA 25, MACD 12/26/9, Bollinger 20/2, deviation rate 25.
     */
    public static IndicatorSet calculateIndicatorSet(PriceSeries series) {
        List<BigDecimal> closes = series.closes();
        return new IndicatorSet(
            calculateRSI(closes, DEFAULT_RSI_PERIOD),
            calculateSMA(closes, DEFAULT_MA_PERIOD),
            calculateEMA(closes, DEFAULT_MA_PERIOD),
            calculateMACD(closes),
            calculateBollingerBands(closes, DEFAULT_BOLLINGER_PERIOD, DEFAULT_BOLLINGER_MULTIPLIER),
            calculateDeviationRate(closes, IndicatorThresholds.DEVIATION_PERIOD)
        );
    }

    // ==================== Helper Methods ====================

    /**
     * Round to two decimals, the precision of every published indicator value.
     */
    public static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal sum(List<BigDecimal> values) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            total = total.add(value);
        }
        return total;
    }

    /**
     * Unrounded SMA of the last {@code period} values.
     */
    private static BigDecimal sma(List<BigDecimal> prices, int period) {
        requirePositive(period);
        if (prices == null || prices.size() < period) {
            return null;
        }
        return sum(prices.subList(prices.size() - period, prices.size()))
            .divide(BigDecimal.valueOf(period), SCALE, RoundingMode.HALF_UP);
    }

    /**
     * EMA at every index from {@code period - 1} to the end, unrounded.
     * Empty when there are fewer than {@code period} values.
     */
    private static List<BigDecimal> emaSeries(List<BigDecimal> values, int period) {
        requirePositive(period);
        List<BigDecimal> series = new ArrayList<>();
        if (values == null || values.size() < period) {
            return series;
        }

        BigDecimal multiplier = new BigDecimal("2").divide(
            BigDecimal.valueOf(period + 1), SCALE, RoundingMode.HALF_UP
        );

        // Start with SMA for the first EMA value
        BigDecimal ema = sum(values.subList(0, period))
            .divide(BigDecimal.valueOf(period), SCALE, RoundingMode.HALF_UP);
        series.add(ema);

        for (int i = period; i < values.size(); i++) {
            ema = values.get(i).subtract(ema).multiply(multiplier).add(ema)
                .setScale(SCALE, RoundingMode.HALF_UP);
            series.add(ema);
        }

        return series;
    }

    private static void requirePositive(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
    }
}
