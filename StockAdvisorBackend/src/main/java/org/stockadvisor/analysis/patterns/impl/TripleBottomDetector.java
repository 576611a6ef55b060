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
 * Triple Bottom
 *
 * Three consecutive troughs at a similar level separated by at least two peaks.
 */
public class TripleBottomDetector extends AbstractChartPatternDetector {

    public TripleBottomDetector() {
        super(ChartPatternType.TRIPLE_BOTTOM);
    }

    @Override
    public int getMinimumBars(ChartPatternThresholds thresholds) {
        return thresholds.getTriplePatternMinimumBars();
    }

    @Override
    protected Optional<ChartPatternMatch> doDetect(PatternContext context) {
        List<Integer> troughs = context.troughs();
        List<Integer> peaks = context.peaks();
        if (troughs.size() < 3 || peaks.size() < 2) {
            return Optional.empty();
        }
        BigDecimal tolerance = context.getThresholds().getLevelTolerance();

        for (int i = 0; i <= troughs.size() - 3; i++) {
            int first = troughs.get(i);
            int third = troughs.get(i + 2);

            BigDecimal low1 = context.bar(first).getLow();
            BigDecimal low2 = context.bar(troughs.get(i + 1)).getLow();
            BigDecimal low3 = context.bar(third).getLow();

            if (!isSimilarPrice(low1, low2, tolerance) ||
                !isSimilarPrice(low2, low3, tolerance) ||
                !isSimilarPrice(low1, low3, tolerance)) {
                continue;
            }

            List<Integer> middlePeaks = between(peaks, first, third);
            if (middlePeaks.size() < 2) continue;

            BigDecimal neckline = max(context.highsAt(middlePeaks));
            BigDecimal support = low1.min(low2).min(low3);
            boolean breakout = context.latestClose().compareTo(neckline) > 0;

            return match(
                breakout ? 88 : 72,
                breakout ? "0.78" : "0.58",
                breakout ? "Triple bottom confirmed, solid floor" : "Triple bottom forming",
                "Support held three times near " + price(support) + ". " +
                    (breakout
                        ? "Price has closed above the neckline at " + price(neckline) + "."
                        : "The neckline at " + price(neckline) + " has not been broken yet."),
                first, third
            );
        }
        return Optional.empty();
    }
}
