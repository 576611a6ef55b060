package org.stockadvisor.analysis.candlestick;

import org.junit.jupiter.api.Test;
import org.stockadvisor.analysis.model.CandleSignal;
import org.stockadvisor.analysis.model.CandlestickPattern;
import org.stockadvisor.analysis.model.CandlestickPatternType;
import org.stockadvisor.analysis.model.CandlestickSummary;
import org.stockadvisor.analysis.model.PriceBar;
import org.stockadvisor.analysis.model.PriceSeries;
import org.stockadvisor.analysis.model.Signal;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.stockadvisor.analysis.PriceSeriesFixtures.*;

class CandlestickClassifierTest {

    // ==================== Single Bar ====================

    @Test
    void testFlatBarIsDoji() {
        CandlestickPattern pattern = classify(100, 100, 100, 100);
        assertEquals(CandlestickPatternType.DOJI, pattern.getPattern());
        assertEquals(Signal.NEUTRAL, pattern.getSignal());
        assertEquals(30, pattern.getStrength());
    }

    @Test
    void testBullishShapes() {
        assertEquals(CandlestickPatternType.BULLISH_STRONG, classify(100, 110.2, 99.8, 110).getPattern());
        assertEquals(CandlestickPatternType.BULLISH_HAMMER, classify(100, 101, 95, 100.8).getPattern());
        assertEquals(CandlestickPatternType.BULLISH_PULLBACK, classify(100, 106, 99.9, 101).getPattern());
        assertEquals(CandlestickPatternType.BULLISH_SMALL, classify(100, 102, 98, 100.2).getPattern());
        assertEquals(CandlestickPatternType.BULLISH_NORMAL, classify(100, 104, 98.5, 102.5).getPattern());
    }

    @Test
    void testBearishShapes() {
        assertEquals(CandlestickPatternType.BEARISH_STRONG, classify(110, 110.2, 99.8, 100).getPattern());
        assertEquals(CandlestickPatternType.BEARISH_REJECTED_RALLY, classify(101, 106, 99.9, 100).getPattern());
        assertEquals(CandlestickPatternType.BEARISH_SLIP, classify(100.8, 101, 95, 100).getPattern());
        assertEquals(CandlestickPatternType.BEARISH_SMALL, classify(100.2, 102, 98, 100).getPattern());
        assertEquals(CandlestickPatternType.BEARISH_NORMAL, classify(102.5, 104, 98.5, 100).getPattern());
    }

    @Test
    void testUnchangedCloseWithRangeTakesBullishBranch() {
        CandlestickPattern pattern = classify(100, 101, 99, 100);
        assertEquals(CandlestickPatternType.BULLISH_SMALL, pattern.getPattern());
        assertEquals(Signal.BUY, pattern.getSignal());
    }

    @Test
    void testStrengthAndSignalComeFromType() {
        CandlestickPattern hammer = classify(100, 101, 95, 100.8);
        assertEquals(Signal.BUY, hammer.getSignal());
        assertEquals(75, hammer.getStrength());
        assertNotNull(hammer.getDescription());
        assertNotNull(hammer.getExplanation());

        CandlestickPattern strongBear = classify(110, 110.2, 99.8, 100);
        assertEquals(Signal.SELL, strongBear.getSignal());
        assertEquals(80, strongBear.getStrength());
    }

    @Test
    void testNullBarIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CandlestickClassifier.classify(null));
    }

    // ==================== Series ====================

    @Test
    void testRecentSignalsAreNotableAndNewestFirst() {
        List<CandleSignal> signals = CandlestickClassifier.recentSignals(sampleSeries(), 10);

        assertEquals(3, signals.size());
        assertEquals(CandlestickPatternType.BEARISH_STRONG, signals.get(0).getPattern());
        assertEquals(START.plusDays(3), signals.get(0).getDate());
        assertEquals(CandlestickPatternType.BULLISH_HAMMER, signals.get(1).getPattern());
        assertEquals(CandlestickPatternType.BULLISH_STRONG, signals.get(2).getPattern());
        for (CandleSignal signal : signals) {
            assertTrue(signal.getStrength() >= CandlestickClassifier.NOTABLE_STRENGTH);
        }
    }

    @Test
    void testRecentSignalsRespectMaximum() {
        List<CandleSignal> signals = CandlestickClassifier.recentSignals(sampleSeries(), 2);
        assertEquals(2, signals.size());
        assertEquals(CandlestickPatternType.BULLISH_HAMMER, signals.get(1).getPattern());
    }

    @Test
    void testSummaryCountsNotableCandlesInLookback() {
        CandlestickSummary summary = CandlestickClassifier.summarize(sampleSeries(), 3);

        assertEquals(CandlestickPatternType.DOJI, summary.getLatest().getPattern());
        assertEquals(1, summary.getBuySignals());
        assertEquals(1, summary.getSellSignals());
    }

    @Test
    void testSummaryOfEmptySeriesIsNull() {
        assertNull(CandlestickClassifier.summarize(PriceSeries.empty(), 5));
        assertTrue(CandlestickClassifier.recentSignals(PriceSeries.empty(), 5).isEmpty());
    }

    // ==================== Helper Methods ====================

    private CandlestickPattern classify(double open, double high, double low, double close) {
        return CandlestickClassifier.classify(createBar(START, open, high, low, close));
    }

    /**
     * Strong bull, small bull, hammer, strong bear, doji.
     */
    private PriceSeries sampleSeries() {
        List<PriceBar> bars = List.of(
            createBar(START, 100, 110.2, 99.8, 110),
            createBar(START.plusDays(1), 100, 102, 98, 100.2),
            createBar(START.plusDays(2), 100, 101, 95, 100.8),
            createBar(START.plusDays(3), 110, 110.2, 99.8, 100),
            createBar(START.plusDays(4), 100, 100, 100, 100)
        );
        return PriceSeries.oldestFirst(bars);
    }
}
