package org.stockadvisor.analysis.indicators;

import java.math.BigDecimal;

/**
 * Shared indicator thresholds.
 *
 * Several consumers read the same levels (the signal combiner, the
 * interpretation zones, the safety rules and the prompt layer downstream),
 * so they live here instead of being repeated as literals.
 */
public final class IndicatorThresholds {

    private IndicatorThresholds() {
    }

    // RSI
    public static final BigDecimal RSI_OVERSOLD = new BigDecimal("30");
    public static final BigDecimal RSI_WEAK_OVERSOLD = new BigDecimal("40");
    public static final BigDecimal RSI_WEAK_OVERBOUGHT = new BigDecimal("60");
    public static final BigDecimal RSI_OVERBOUGHT = new BigDecimal("70");

    // MACD histogram beyond which momentum is called out explicitly
    public static final BigDecimal MACD_STRONG_MOMENTUM = BigDecimal.ONE;

    // Moving-average deviation rate, percent
    public static final int DEVIATION_PERIOD = 25;
    public static final BigDecimal DEVIATION_UPPER = new BigDecimal("20");
    public static final BigDecimal DEVIATION_LOWER = new BigDecimal("-20");
    public static final BigDecimal DEVIATION_STABLE_BAND = new BigDecimal("5");
}
