package org.stockadvisor.analysis.patterns.impl;

import org.stockadvisor.analysis.model.ChartPatternMatch;
import org.stockadvisor.analysis.model.ChartPatternType;
import org.stockadvisor.analysis.patterns.AbstractChartPatternDetector;
import org.stockadvisor.analysis.patterns.ChartPatternThresholds;
import org.stockadvisor.analysis.patterns.PatternContext;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Double Top (M shape)
 *
 * Two peaks at a similar level, at least a few bars apart, with a trough
 * between them. That trough is the neckline.
 */
public class DoubleTopDetector extends AbstractChartPatternDetector {

    public DoubleTopDetector() {
        super(ChartPatternType.DOUBLE_TOP);
    }

    @Override
    public int getMinimumBars(ChartPatternThresholds thresholds) {
        return thresholds.getDoublePatternMinimumBars();
    }

    @Override
    protected Optional<ChartPatternMatch> doDetect(PatternContext context) {
        List<Integer> peaks = context.peaks();
        List<Integer> troughs = context.troughs();
        if (peaks.size() < 2 || troughs.isEmpty()) {
            return Optional.empty();
        }
        ChartPatternThresholds thresholds = context.getThresholds();

        for (int i = 0; i <= peaks.size() - 2; i++) {
            int first = peaks.get(i);
            int second = peaks.get(i + 1);
            if (second - first < thresholds.getMinimumDoubleSeparation()) continue;

            BigDecimal firstHigh = context.bar(first).getHigh();
            BigDecimal secondHigh = context.bar(second).getHigh();
            if (!isSimilarPrice(firstHigh, secondHigh, thresholds.getLevelTolerance())) continue;

            List<Integer> middleTroughs = between(troughs, first, second);
            if (middleTroughs.isEmpty()) continue;

            BigDecimal neckline = min(context.lowsAt(middleTroughs));
            BigDecimal top = firstHigh.max(secondHigh);
            boolean breakdown = context.latestClose().compareTo(neckline) < 0;
            BigDecimal height = top.subtract(neckline).divide(top, SCALE, RoundingMode.HALF_UP);

            return match(
                breakdown ? 78 : 65,
                breakdown ? "0.70" : "0.55",
                breakdown ? "M top confirmed, downtrend likely" : "M top forming",
                "Two highs near " + price(top) + " with a neckline at " + price(neckline) +
                    " (" + percent(height) + " below the highs). " +
                    (breakdown
                        ? "Price has closed below the neckline."
                        : "Watch for a close below the neckline."),
                first, second
            );
        }
        return Optional.empty();
    }
}
