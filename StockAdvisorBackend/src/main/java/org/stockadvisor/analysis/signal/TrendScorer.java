package org.stockadvisor.analysis.signal;

import org.stockadvisor.analysis.indicators.IndicatorThresholds;
import org.stockadvisor.analysis.indicators.TechnicalIndicators;
import org.stockadvisor.analysis.model.MacdResult;
import org.stockadvisor.analysis.model.PriceSeries;
import org.stockadvisor.analysis.model.TrendScore;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Trend Scorer
 * Sums simple votes from RSI, price versus the 25-day SMA and the MACD
 * histogram into a score between -2 and +2, then labels it.
 *
 * This class is stateless and thread-safe - all methods are static
 */
public final class TrendScorer {

    private static final BigDecimal FULL_VOTE = BigDecimal.ONE;
    private static final BigDecimal HALF_VOTE = new BigDecimal("0.5");
    private static final BigDecimal STRONG_LEVEL = new BigDecimal("1.5");

    private TrendScorer() {
        // Utility class - prevent instantiation
    }

    public static TrendScore score(PriceSeries series) {
        if (series == null) {
            throw new IllegalArgumentException("Series cannot be null");
        }
        List<BigDecimal> closes = series.closes();
        BigDecimal rsi = TechnicalIndicators.calculateRSI(closes, TechnicalIndicators.DEFAULT_RSI_PERIOD);
        BigDecimal sma = TechnicalIndicators.calculateSMA(closes, TechnicalIndicators.DEFAULT_MA_PERIOD);
        MacdResult macd = TechnicalIndicators.calculateMACD(closes);

        BigDecimal score = BigDecimal.ZERO;
        List<String> reasons = new ArrayList<>();

        if (rsi != null) {
            if (rsi.compareTo(IndicatorThresholds.RSI_OVERSOLD) < 0) {
                score = score.add(FULL_VOTE);
                reasons.add("RSI " + rsi.setScale(1, RoundingMode.HALF_UP) + " is oversold");
            } else if (rsi.compareTo(IndicatorThresholds.RSI_OVERBOUGHT) > 0) {
                score = score.subtract(FULL_VOTE);
                reasons.add("RSI " + rsi.setScale(1, RoundingMode.HALF_UP) + " is overbought");
            }
        }

        if (sma != null) {
            if (series.latest().getClose().compareTo(sma) > 0) {
                score = score.add(HALF_VOTE);
                reasons.add("Above the 25-day moving average");
            } else {
                score = score.subtract(HALF_VOTE);
                reasons.add("Below the 25-day moving average");
            }
        }

        if (macd != null) {
            if (macd.getHistogram().signum() > 0) {
                score = score.add(HALF_VOTE);
                reasons.add("MACD pointing up");
            } else {
                score = score.subtract(HALF_VOTE);
                reasons.add("MACD pointing down");
            }
        }

        return new TrendScore(score.setScale(2, RoundingMode.HALF_UP), label(score), reasons);
    }

    static TrendScore.Label label(BigDecimal score) {
        if (score.compareTo(STRONG_LEVEL) >= 0) return TrendScore.Label.STRONG_BUY;
        if (score.compareTo(HALF_VOTE) >= 0) return TrendScore.Label.BUY;
        if (score.compareTo(STRONG_LEVEL.negate()) <= 0) return TrendScore.Label.STRONG_SELL;
        if (score.compareTo(HALF_VOTE.negate()) <= 0) return TrendScore.Label.SELL;
        return TrendScore.Label.NEUTRAL;
    }
}
