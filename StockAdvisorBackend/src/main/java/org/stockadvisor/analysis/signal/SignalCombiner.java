package org.stockadvisor.analysis.signal;

import org.stockadvisor.analysis.indicators.IndicatorThresholds;
import org.stockadvisor.analysis.model.CandlestickPattern;
import org.stockadvisor.analysis.model.CombinedSignal;
import org.stockadvisor.analysis.model.IndicatorSet;
import org.stockadvisor.analysis.model.Signal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Signal Combiner
 * Merges the latest candlestick, RSI and MACD histogram into one directional
 * signal with a 0-100 strength and the reasons behind it.
 *
 * Buy and sell evidence is accumulated separately. A side wins only when it
 * leads the other by more than {@value #DECISIVE_MARGIN} points; otherwise the
 * result is neutral with strength {@value #UNDECIDED_STRENGTH}.
 *
 * This class is stateless and thread-safe - all methods are static
 */
public final class SignalCombiner {

    static final int RSI_EXTREME_SCORE = 70;
    static final int RSI_LEANING_SCORE = 30;
    static final int MACD_SCORE = 40;
    static final int DECISIVE_MARGIN = 50;
    static final int UNDECIDED_STRENGTH = 50;

    public static final String REASON_OVERSOLD = "Oversold (RSI)";
    public static final String REASON_OVERBOUGHT = "Overbought (RSI)";
    public static final String REASON_RISING_MOMENTUM = "Rising momentum (MACD)";
    public static final String REASON_FALLING_MOMENTUM = "Falling momentum (MACD)";
    public static final String REASON_INSUFFICIENT_DATA = "Insufficient data";
    public static final String REASON_WAIT_AND_SEE = "Wait and see";

    private SignalCombiner() {
        // Utility class - prevent instantiation
    }

    /**
     * Combine the latest candlestick with the RSI and MACD histogram of an indicator snapshot.
     */
    public static CombinedSignal combine(CandlestickPattern candlestick, IndicatorSet indicators) {
        if (indicators == null) {
            return combine(candlestick, null, null);
        }
        return combine(candlestick, indicators.getRsi(), indicators.getMacdHistogram());
    }

    /**
     * @param candlestick latest bar classification, may be null
     * @param rsi latest RSI, may be null
     * @param macdHistogram latest MACD histogram, may be null
     */
    public static CombinedSignal combine(CandlestickPattern candlestick, BigDecimal rsi, BigDecimal macdHistogram) {
        int buyScore = 0;
        int sellScore = 0;
        List<String> reasons = new ArrayList<>();

        if (candlestick != null) {
            if (candlestick.getSignal() == Signal.BUY) {
                buyScore += candlestick.getStrength();
                reasons.add(candlestick.getDescription());
            } else if (candlestick.getSignal() == Signal.SELL) {
                sellScore += candlestick.getStrength();
                reasons.add(candlestick.getDescription());
            }
        }

        if (rsi != null) {
            if (rsi.compareTo(IndicatorThresholds.RSI_OVERSOLD) <= 0) {
                buyScore += RSI_EXTREME_SCORE;
                reasons.add(REASON_OVERSOLD);
            } else if (rsi.compareTo(IndicatorThresholds.RSI_OVERBOUGHT) >= 0) {
                sellScore += RSI_EXTREME_SCORE;
                reasons.add(REASON_OVERBOUGHT);
            } else if (rsi.compareTo(IndicatorThresholds.RSI_WEAK_OVERSOLD) <= 0) {
                buyScore += RSI_LEANING_SCORE;
            } else if (rsi.compareTo(IndicatorThresholds.RSI_WEAK_OVERBOUGHT) >= 0) {
                sellScore += RSI_LEANING_SCORE;
            }
        }

        if (macdHistogram != null) {
            if (macdHistogram.signum() > 0) {
                buyScore += MACD_SCORE;
                if (macdHistogram.compareTo(IndicatorThresholds.MACD_STRONG_MOMENTUM) > 0) {
                    reasons.add(REASON_RISING_MOMENTUM);
                }
            } else if (macdHistogram.signum() < 0) {
                sellScore += MACD_SCORE;
                if (macdHistogram.compareTo(IndicatorThresholds.MACD_STRONG_MOMENTUM.negate()) < 0) {
                    reasons.add(REASON_FALLING_MOMENTUM);
                }
            }
        }

        int total = buyScore + sellScore;
        if (total == 0) {
            return new CombinedSignal(Signal.NEUTRAL, 0, List.of(REASON_INSUFFICIENT_DATA));
        }

        int diff = buyScore - sellScore;
        if (diff > DECISIVE_MARGIN) {
            return new CombinedSignal(Signal.BUY, share(buyScore, total), reasons);
        }
        if (diff < -DECISIVE_MARGIN) {
            return new CombinedSignal(Signal.SELL, share(sellScore, total), reasons);
        }
        return new CombinedSignal(Signal.NEUTRAL, UNDECIDED_STRENGTH,
            reasons.isEmpty() ? List.of(REASON_WAIT_AND_SEE) : reasons);
    }

    /** Winning side's share of the total evidence, as a whole percentage capped at 100. */
    private static int share(int score, int total) {
        int percent = BigDecimal.valueOf(score * 100L)
            .divide(BigDecimal.valueOf(total), 0, RoundingMode.HALF_UP)
            .intValue();
        return Math.min(percent, 100);
    }
}
