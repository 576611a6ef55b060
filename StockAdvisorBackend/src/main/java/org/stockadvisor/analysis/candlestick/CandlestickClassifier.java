package org.stockadvisor.analysis.candlestick;

import org.stockadvisor.analysis.model.CandleSignal;
import org.stockadvisor.analysis.model.CandlestickPattern;
import org.stockadvisor.analysis.model.CandlestickPatternType;
import org.stockadvisor.analysis.model.CandlestickSummary;
import org.stockadvisor.analysis.model.PriceBar;
import org.stockadvisor.analysis.model.PriceSeries;
import org.stockadvisor.analysis.model.Signal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Candlestick Classifier
 *
 * Classifies a single OHLC bar from its body and wick proportions:
 * - body      = |close - open|
 * - range     = high - low
 * - upperWick = high - max(open, close)
 * - lowerWick = min(open, close) - low
 *
 * Rules are applied in order and the first match wins. A bar whose range is
 * below {@link #MIN_RANGE} is a doji, which also keeps the ratios below from
 * dividing by zero.
 *
 * Stateless and thread-safe.
 */
public final class CandlestickClassifier {

    /** Absolute range below which a bar is treated as flat. */
    public static final BigDecimal MIN_RANGE = new BigDecimal("0.01");
    public static final BigDecimal LARGE_BODY_RATIO = new BigDecimal("0.6");
    public static final BigDecimal SMALL_BODY_RATIO = new BigDecimal("0.2");
    public static final BigDecimal LONG_WICK_RATIO = new BigDecimal("0.3");

    /** Minimum strength for a bar to count as a notable signal in history scans. */
    public static final int NOTABLE_STRENGTH = 60;
    public static final int DEFAULT_MAX_SIGNALS = 10;
    public static final int DEFAULT_SUMMARY_LOOKBACK = 5;

    private static final int RATIO_SCALE = 8;

    private CandlestickClassifier() {
    }

    public static CandlestickPattern classify(PriceBar bar) {
        if (bar == null) {
            throw new IllegalArgumentException("Bar cannot be null");
        }
        return new CandlestickPattern(classifyType(bar));
    }

    static CandlestickPatternType classifyType(PriceBar bar) {
        BigDecimal open = bar.getOpen();
        BigDecimal close = bar.getClose();
        BigDecimal range = bar.getHigh().subtract(bar.getLow());

        if (range.compareTo(MIN_RANGE) < 0) {
            return CandlestickPatternType.DOJI;
        }

        BigDecimal body = close.subtract(open).abs();
        BigDecimal upperWick = bar.getHigh().subtract(open.max(close));
        BigDecimal lowerWick = open.min(close).subtract(bar.getLow());

        BigDecimal bodyRatio = body.divide(range, RATIO_SCALE, RoundingMode.HALF_UP);
        boolean largeBody = bodyRatio.compareTo(LARGE_BODY_RATIO) >= 0;
        boolean smallBody = bodyRatio.compareTo(SMALL_BODY_RATIO) <= 0;
        boolean longUpperWick = upperWick.divide(range, RATIO_SCALE, RoundingMode.HALF_UP).compareTo(LONG_WICK_RATIO) >= 0;
        boolean longLowerWick = lowerWick.divide(range, RATIO_SCALE, RoundingMode.HALF_UP).compareTo(LONG_WICK_RATIO) >= 0;

        if (close.compareTo(open) >= 0) {
            if (largeBody && !longUpperWick && !longLowerWick) {
                return CandlestickPatternType.BULLISH_STRONG;
            }
            if (longLowerWick && !longUpperWick) {
                return CandlestickPatternType.BULLISH_HAMMER;
            }
            if (longUpperWick && !longLowerWick) {
                return CandlestickPatternType.BULLISH_PULLBACK;
            }
            if (smallBody) {
                return CandlestickPatternType.BULLISH_SMALL;
            }
            return CandlestickPatternType.BULLISH_NORMAL;
        }

        if (largeBody && !longUpperWick && !longLowerWick) {
            return CandlestickPatternType.BEARISH_STRONG;
        }
        if (longUpperWick && !longLowerWick) {
            return CandlestickPatternType.BEARISH_REJECTED_RALLY;
        }
        if (longLowerWick && !longUpperWick) {
            return CandlestickPatternType.BEARISH_SLIP;
        }
        if (smallBody) {
            return CandlestickPatternType.BEARISH_SMALL;
        }
        return CandlestickPatternType.BEARISH_NORMAL;
    }

    /**
     * Notable candles (strength of {@value #NOTABLE_STRENGTH} or more), newest first.
     * @param series oldest-first series
     * @param maxSignals upper bound on the number of entries returned
     */
    public static List<CandleSignal> recentSignals(PriceSeries series, int maxSignals) {
        List<CandleSignal> signals = new ArrayList<>();
        for (int i = series.size() - 1; i >= 0 && signals.size() < maxSignals; i--) {
            PriceBar bar = series.get(i);
            CandlestickPatternType type = classifyType(bar);
            if (type.getStrength() >= NOTABLE_STRENGTH) {
                signals.add(new CandleSignal(bar.getDate(), type, bar.getClose()));
            }
        }
        return signals;
    }

    /**
     * Latest classification plus the count of notable buy and sell candles in
     * the last {@code lookback} bars.
     * @return the summary, or null for an empty series
     */
    public static CandlestickSummary summarize(PriceSeries series, int lookback) {
        if (series.isEmpty()) {
            return null;
        }
        int buys = 0;
        int sells = 0;
        for (PriceBar bar : series.tail(lookback).getBars()) {
            CandlestickPatternType type = classifyType(bar);
            if (type.getStrength() < NOTABLE_STRENGTH) {
                continue;
            }
            if (type.getSignal() == Signal.BUY) {
                buys++;
            } else if (type.getSignal() == Signal.SELL) {
                sells++;
            }
        }
        return new CandlestickSummary(classify(series.latest()), Math.min(lookback, series.size()), buys, sells);
    }
}
