package org.stockadvisor.analysis.patterns.impl;

import org.stockadvisor.analysis.model.ChartPatternMatch;
import org.stockadvisor.analysis.model.ChartPatternType;
import org.stockadvisor.analysis.patterns.AbstractChartPatternDetector;
import org.stockadvisor.analysis.patterns.ChartPatternThresholds;
import org.stockadvisor.analysis.patterns.PatternContext;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Ascending Triangle
 *
 * Flat resistance across the peaks with rising support across the troughs.
 * Resistance is the average peak high.
 */
public class AscendingTriangleDetector extends AbstractChartPatternDetector {

    public AscendingTriangleDetector() {
        super(ChartPatternType.ASCENDING_TRIANGLE);
    }

    @Override
    protected Optional<ChartPatternMatch> doDetect(PatternContext context) {
        List<Integer> peaks = context.peaks();
        List<Integer> troughs = context.troughs();
        if (peaks.size() < 2 || troughs.size() < 2) {
            return Optional.empty();
        }
        ChartPatternThresholds thresholds = context.getThresholds();

        List<BigDecimal> peakHighs = context.highsAt(peaks);
        List<BigDecimal> troughLows = context.lowsAt(troughs);
        BigDecimal peakSlope = normalizedSlope(peakHighs);
        BigDecimal troughSlope = normalizedSlope(troughLows);
        if (peakSlope == null || troughSlope == null) {
            return Optional.empty();
        }

        if (peakSlope.abs().compareTo(thresholds.getFlatSlope()) > 0) return Optional.empty();
        if (troughSlope.compareTo(thresholds.getTrendSlope()) <= 0) return Optional.empty();

        BigDecimal resistance = average(peakHighs);
        boolean breakout = context.latestClose().compareTo(resistance) > 0;
        int[] span = span(peaks, troughs);

        return match(
            breakout ? 85 : 70,
            breakout ? "0.75" : "0.55",
            breakout ? "Resistance broken upward" : "Ascending triangle, buyers gaining ground",
            "Highs are flat near " + price(resistance) + " while lows keep rising. " +
                (breakout
                    ? "Price has closed above resistance."
                    : "A close above resistance would signal an upside breakout."),
            span[0], span[1]
        );
    }
}
