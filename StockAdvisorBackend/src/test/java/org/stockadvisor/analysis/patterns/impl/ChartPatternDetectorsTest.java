package org.stockadvisor.analysis.patterns.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stockadvisor.analysis.model.ChartPatternMatch;
import org.stockadvisor.analysis.model.ChartPatternType;
import org.stockadvisor.analysis.model.PatternRank;
import org.stockadvisor.analysis.model.PriceSeries;
import org.stockadvisor.analysis.model.Signal;
import org.stockadvisor.analysis.patterns.ChartPatternDetector;
import org.stockadvisor.analysis.patterns.ChartPatternThresholds;
import org.stockadvisor.analysis.patterns.PatternContext;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.stockadvisor.analysis.PriceSeriesFixtures.*;

/**
 * Individual detectors against hand-shaped series.
 */
class ChartPatternDetectorsTest {

    private ChartPatternThresholds thresholds;

    @BeforeEach
    void setUp() {
        thresholds = new ChartPatternThresholds();
    }

    @Test
    void testHeadAndShouldersBreakdown() {
        ChartPatternMatch match = detect(new HeadAndShouldersDetector(), fromCloses(headAndShoulders())).orElseThrow();

        assertEquals(ChartPatternType.HEAD_AND_SHOULDERS, match.getPattern());
        assertEquals(Signal.SELL, match.getSignal());
        assertEquals(95, match.getStrength());
        assertEquals(5, match.getStartIndex());
        assertEquals(25, match.getEndIndex());
    }

    @Test
    void testInverseHeadAndShouldersIsMirror() {
        double[] top = headAndShoulders();
        double[] mirrored = new double[top.length];
        for (int i = 0; i < top.length; i++) {
            mirrored[i] = 200 - top[i];
        }
        ChartPatternMatch match = detect(new InverseHeadAndShouldersDetector(), fromCloses(mirrored)).orElseThrow();

        assertEquals(Signal.BUY, match.getSignal());
        assertEquals(95, match.getStrength());
        assertEquals(0, new BigDecimal("0.85").compareTo(match.getConfidence()));
    }

    @Test
    void testDoubleTopNotConfirmedWhenShouldersDiffer() {
        // the H&S peaks are 105.5 / 110.5 / 105.5, never within 4% of each other pairwise
        assertTrue(detect(new DoubleTopDetector(), fromCloses(headAndShoulders())).isEmpty());
    }

    @Test
    void testDoubleTopFromMirroredDoubleBottom() {
        double[] bottom = doubleBottom();
        double[] mirrored = new double[bottom.length];
        for (int i = 0; i < bottom.length; i++) {
            mirrored[i] = 220 - bottom[i];
        }
        ChartPatternMatch match = detect(new DoubleTopDetector(), fromCloses(mirrored)).orElseThrow();

        assertEquals(Signal.SELL, match.getSignal());
        assertEquals(78, match.getStrength());
        assertEquals(0, new BigDecimal("0.70").compareTo(match.getConfidence()));
    }

    @Test
    void testAscendingTriangle() {
        PriceSeries series = fromCloses(segments(new double[][]{
            {0, 100}, {4, 110}, {8, 102}, {12, 110}, {16, 104}, {20, 110}, {24, 106}, {27, 112}
        }));
        ChartPatternMatch match = detect(new AscendingTriangleDetector(), series).orElseThrow();

        assertEquals(85, match.getStrength());
        assertEquals(4, match.getStartIndex());
        assertEquals(24, match.getEndIndex());
        assertTrue(detect(new DescendingTriangleDetector(), series).isEmpty());
    }

    @Test
    void testDescendingTriangleBreakdown() {
        PriceSeries series = fromCloses(segments(new double[][]{
            {0, 104}, {4, 110}, {8, 100}, {12, 108}, {16, 100}, {20, 106}, {24, 96}
        }));
        ChartPatternMatch match = detect(new DescendingTriangleDetector(), series).orElseThrow();

        assertEquals(ChartPatternType.DESCENDING_TRIANGLE, match.getPattern());
        assertEquals(Signal.SELL, match.getSignal());
        assertEquals(PatternRank.S, match.getRank());
        assertEquals(87, match.getReferenceWinRate());
        assertEquals(90, match.getStrength());
        assertEquals(0, new BigDecimal("0.82").compareTo(match.getConfidence()));
        assertEquals(4, match.getStartIndex());
        assertEquals(20, match.getEndIndex());
    }

    @Test
    void testDescendingTriangleFormingAboveSupport() {
        PriceSeries series = fromCloses(segments(new double[][]{
            {0, 104}, {4, 110}, {8, 100}, {12, 108}, {16, 100}, {20, 106}, {24, 103}
        }));
        ChartPatternMatch match = detect(new DescendingTriangleDetector(), series).orElseThrow();

        assertEquals(75, match.getStrength());
        assertEquals(0, new BigDecimal("0.60").compareTo(match.getConfidence()));
    }

    @Test
    void testTripleBottomBreakout() {
        ChartPatternMatch match = detect(new TripleBottomDetector(), fromCloses(tripleBottom(112))).orElseThrow();

        assertEquals(ChartPatternType.TRIPLE_BOTTOM, match.getPattern());
        assertEquals(Signal.BUY, match.getSignal());
        assertEquals(PatternRank.A, match.getRank());
        assertEquals(87, match.getReferenceWinRate());
        assertEquals(88, match.getStrength());
        assertEquals(0, new BigDecimal("0.78").compareTo(match.getConfidence()));
        assertEquals(5, match.getStartIndex());
        assertEquals(25, match.getEndIndex());
    }

    @Test
    void testTripleBottomFormingBelowNeckline() {
        // neckline is the 108.5 high of the middle peaks
        ChartPatternMatch match = detect(new TripleBottomDetector(), fromCloses(tripleBottom(105))).orElseThrow();

        assertEquals(72, match.getStrength());
        assertEquals(0, new BigDecimal("0.58").compareTo(match.getConfidence()));
        assertEquals(5, match.getStartIndex());
        assertEquals(25, match.getEndIndex());
    }

    @Test
    void testBullFlag() {
        PriceSeries series = fromCloses(segments(new double[][]{{0, 100}, {5, 100}, {15, 110}, {29, 109}}));
        ChartPatternMatch match = detect(new BullFlagDetector(), series).orElseThrow();

        assertEquals(ChartPatternType.BULL_FLAG, match.getPattern());
        assertEquals(58, match.getStrength());
        assertEquals(5, match.getStartIndex());
        assertEquals(29, match.getEndIndex());
        assertTrue(detect(new BearFlagDetector(), series).isEmpty());
    }

    @Test
    void testBearFlag() {
        PriceSeries series = fromCloses(segments(new double[][]{{0, 100}, {5, 100}, {15, 90}, {29, 91}}));
        ChartPatternMatch match = detect(new BearFlagDetector(), series).orElseThrow();

        assertEquals(Signal.SELL, match.getSignal());
        assertTrue(detect(new BullFlagDetector(), series).isEmpty());
    }

    @Test
    void testSymmetricalTriangle() {
        PriceSeries series = fromCloses(segments(new double[][]{
            {0, 100}, {4, 112}, {8, 92}, {12, 110}, {16, 95}, {20, 108}, {24, 98}, {28, 104}, {30, 101}
        }));
        ChartPatternMatch match = detect(new SymmetricalTriangleDetector(), series).orElseThrow();

        assertEquals(Signal.NEUTRAL, match.getSignal());
        assertEquals(55, match.getStrength());
    }

    @Test
    void testBoxRange() {
        PriceSeries series = fromCloses(segments(new double[][]{
            {0, 100}, {4, 108}, {8, 100}, {12, 108}, {16, 100}, {20, 108}, {24, 104}
        }));
        ChartPatternMatch match = detect(new BoxRangeDetector(), series).orElseThrow();

        assertEquals(ChartPatternType.BOX_RANGE, match.getPattern());
        assertEquals(4, match.getStartIndex());
        assertEquals(20, match.getEndIndex());
    }

    @Test
    void testMinimumBarsPerDetector() {
        assertEquals(10, new DoubleBottomDetector().getMinimumBars(thresholds));
        assertEquals(20, new TripleBottomDetector().getMinimumBars(thresholds));
        assertEquals(15, new HeadAndShouldersDetector().getMinimumBars(thresholds));

        thresholds.setTriplePatternMinimumBars(25);
        assertEquals(25, new TripleBottomDetector().getMinimumBars(thresholds));
    }

    @Test
    void testTighterToleranceRejectsDoubleBottom() {
        thresholds.setLevelTolerance(new BigDecimal("0.001"));
        assertTrue(detect(new DoubleBottomDetector(), fromCloses(doubleBottom())).isEmpty());
    }

    // ==================== Helper Methods ====================

    private double[] tripleBottom(double lastClose) {
        return segments(new double[][]{
            {0, 110}, {5, 100}, {10, 108}, {15, 100.5}, {20, 108}, {25, 100}, {30, lastClose}
        });
    }

    private Optional<ChartPatternMatch> detect(ChartPatternDetector detector, PriceSeries series) {
        return detector.detect(PatternContext.of(series, thresholds));
    }
}
