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
 * Double Bottom (W shape)
 *
 * Two troughs at a similar level, at least a few bars apart, with a peak
 * between them. That peak is the neckline.
 */
public class DoubleBottomDetector extends AbstractChartPatternDetector {

    public DoubleBottomDetector() {
        super(ChartPatternType.DOUBLE_BOTTOM);
    }

    @Override
    public int getMinimumBars(ChartPatternThresholds thresholds) {
        return thresholds.getDoublePatternMinimumBars();
    }

    @Override
    protected Optional<ChartPatternMatch> doDetect(PatternContext context) {
        List<Integer> troughs = context.troughs();
        List<Integer> peaks = context.peaks();
        if (troughs.size() < 2 || peaks.isEmpty()) {
            return Optional.empty();
        }
        ChartPatternThresholds thresholds = context.getThresholds();

        for (int i = 0; i <= troughs.size() - 2; i++) {
            int first = troughs.get(i);
            int second = troughs.get(i + 1);
            if (second - first < thresholds.getMinimumDoubleSeparation()) continue;

            BigDecimal firstLow = context.bar(first).getLow();
            BigDecimal secondLow = context.bar(second).getLow();
            if (!isSimilarPrice(firstLow, secondLow, thresholds.getLevelTolerance())) continue;

            List<Integer> middlePeaks = between(peaks, first, second);
            if (middlePeaks.isEmpty()) continue;

            BigDecimal neckline = max(context.highsAt(middlePeaks));
            BigDecimal bottom = firstLow.min(secondLow);
            boolean breakout = context.latestClose().compareTo(neckline) > 0;
            BigDecimal height = relativeChange(bottom, neckline);

            return match(
                breakout ? 92 : 78,
                breakout ? "0.82" : "0.62",
                breakout ? "W bottom confirmed, uptrend likely" : "W bottom forming",
                "Two lows near " + price(bottom) + " with a neckline at " + price(neckline) +
                    " (" + percent(height) + " above the lows). " +
                    (breakout
                        ? "Price has closed above the neckline."
                        : "Waiting for a close above the neckline."),
                first, second
            );
        }
        return Optional.empty();
    }
}
