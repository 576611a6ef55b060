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
 * Descending Triangle
 *
 * Flat support across the troughs with falling resistance across the peaks.
 * Support is the average trough low.
 */
public class DescendingTriangleDetector extends AbstractChartPatternDetector {

    public DescendingTriangleDetector() {
        super(ChartPatternType.DESCENDING_TRIANGLE);
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

        if (troughSlope.abs().compareTo(thresholds.getFlatSlope()) > 0) return Optional.empty();
        if (peakSlope.compareTo(thresholds.getTrendSlope().negate()) >= 0) return Optional.empty();

        BigDecimal support = average(troughLows);
        boolean breakdown = context.latestClose().compareTo(support) < 0;
        int[] span = span(peaks, troughs);

        return match(
            breakdown ? 90 : 75,
            breakdown ? "0.82" : "0.60",
            breakdown ? "Support broken downward" : "Descending triangle, sellers in control",
            "Lows are flat near " + price(support) + " while highs keep falling. " +
                (breakdown
                    ? "Price has closed below support."
                    : "A close below support would signal a downside breakout."),
            span[0], span[1]
        );
    }
}
