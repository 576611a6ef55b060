package org.stockadvisor.analysis.signal;

import org.junit.jupiter.api.Test;
import org.stockadvisor.analysis.model.CandlestickPattern;
import org.stockadvisor.analysis.model.CandlestickPatternType;
import org.stockadvisor.analysis.model.CombinedSignal;
import org.stockadvisor.analysis.model.Signal;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalCombinerTest {

    private static final CandlestickPattern STRONG_BULL = new CandlestickPattern(CandlestickPatternType.BULLISH_STRONG);
    private static final CandlestickPattern STRONG_BEAR = new CandlestickPattern(CandlestickPatternType.BEARISH_STRONG);
    private static final CandlestickPattern DOJI = new CandlestickPattern(CandlestickPatternType.DOJI);

    @Test
    void testOversoldRisingBullishIsBuy() {
        CombinedSignal result = SignalCombiner.combine(STRONG_BULL, new BigDecimal("25"), new BigDecimal("2"));

        assertEquals(Signal.BUY, result.getSignal());
        assertTrue(result.getStrength() >= 80);
        assertEquals(100, result.getStrength());
        assertEquals(List.of(STRONG_BULL.getDescription(), SignalCombiner.REASON_OVERSOLD,
            SignalCombiner.REASON_RISING_MOMENTUM), result.getReasons());
    }

    @Test
    void testOverboughtFallingBearishIsSell() {
        CombinedSignal result = SignalCombiner.combine(STRONG_BEAR, new BigDecimal("75"), new BigDecimal("-1.5"));

        assertEquals(Signal.SELL, result.getSignal());
        assertEquals(100, result.getStrength());
        assertTrue(result.getReasons().contains(SignalCombiner.REASON_OVERBOUGHT));
        assertTrue(result.getReasons().contains(SignalCombiner.REASON_FALLING_MOMENTUM));
    }

    @Test
    void testNoInputsIsInsufficientData() {
        CombinedSignal result = SignalCombiner.combine(null, null, (BigDecimal) null);

        assertEquals(Signal.NEUTRAL, result.getSignal());
        assertEquals(0, result.getStrength());
        assertEquals(List.of(SignalCombiner.REASON_INSUFFICIENT_DATA), result.getReasons());
    }

    @Test
    void testNeutralCandleAloneIsInsufficientData() {
        CombinedSignal result = SignalCombiner.combine(DOJI, new BigDecimal("50"), BigDecimal.ZERO);

        assertEquals(Signal.NEUTRAL, result.getSignal());
        assertEquals(0, result.getStrength());
        assertEquals(List.of(SignalCombiner.REASON_INSUFFICIENT_DATA), result.getReasons());
    }

    @Test
    void testNeutralCandleAddsNoReason() {
        CombinedSignal buy = SignalCombiner.combine(DOJI, new BigDecimal("25"), new BigDecimal("0.5"));
        assertEquals(Signal.BUY, buy.getSignal());
        assertEquals(List.of(SignalCombiner.REASON_OVERSOLD), buy.getReasons());

        // buy 70 vs sell 40
        CombinedSignal undecided = SignalCombiner.combine(DOJI, new BigDecimal("25"), new BigDecimal("-2"));
        assertEquals(Signal.NEUTRAL, undecided.getSignal());
        assertEquals(List.of(SignalCombiner.REASON_OVERSOLD, SignalCombiner.REASON_FALLING_MOMENTUM),
            undecided.getReasons());
    }

    @Test
    void testBalancedEvidenceWaitsAndSees() {
        // buy 30 (RSI 40) vs sell 40 (MACD below zero), no reason text collected
        CombinedSignal result = SignalCombiner.combine(null, new BigDecimal("40"), new BigDecimal("-0.5"));

        assertEquals(Signal.NEUTRAL, result.getSignal());
        assertEquals(50, result.getStrength());
        assertEquals(List.of(SignalCombiner.REASON_WAIT_AND_SEE), result.getReasons());
    }

    @Test
    void testMarginMustExceedFifty() {
        // buy 40 + 30 = 70 vs sell 0: decisive
        CombinedSignal decisive = SignalCombiner.combine(null, new BigDecimal("35"), new BigDecimal("0.5"));
        assertEquals(Signal.BUY, decisive.getSignal());
        assertEquals(100, decisive.getStrength());

        // buy 80 vs sell 30: margin of exactly 50 stays neutral
        CombinedSignal borderline = SignalCombiner.combine(STRONG_BULL, new BigDecimal("65"), null);
        assertEquals(Signal.NEUTRAL, borderline.getSignal());
        assertEquals(List.of(STRONG_BULL.getDescription()), borderline.getReasons());
    }

    @Test
    void testStrengthIsShareOfEvidence() {
        // buy 80 + 70 = 150 vs sell 40: 150 / 190 = 78.9%
        CombinedSignal result = SignalCombiner.combine(STRONG_BULL, new BigDecimal("20"), new BigDecimal("-0.2"));

        assertEquals(Signal.BUY, result.getSignal());
        assertEquals(79, result.getStrength());
    }
}
