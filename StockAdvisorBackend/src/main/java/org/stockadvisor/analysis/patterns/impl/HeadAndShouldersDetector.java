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
 * Head and Shoulders
 *
 * Three consecutive peaks where the head is higher than both shoulders and
 * the shoulders sit at a similar level. The neckline is the lowest trough
 * between the shoulders; a close below it confirms the top.
 */
public class HeadAndShouldersDetector extends AbstractChartPatternDetector {

    public HeadAndShouldersDetector() {
        super(ChartPatternType.HEAD_AND_SHOULDERS);
    }

    @Override
    protected Optional<ChartPatternMatch> doDetect(PatternContext context) {
        List<Integer> peaks = context.peaks();
        List<Integer> troughs = context.troughs();
        if (peaks.size() < 3 || troughs.size() < 2) {
            return Optional.empty();
        }
        ChartPatternThresholds thresholds = context.getThresholds();

        for (int i = 0; i <= peaks.size() - 3; i++) {
            int leftShoulder = peaks.get(i);
            int head = peaks.get(i + 1);
            int rightShoulder = peaks.get(i + 2);

            BigDecimal leftHigh = context.bar(leftShoulder).getHigh();
            BigDecimal headHigh = context.bar(head).getHigh();
            BigDecimal rightHigh = context.bar(rightShoulder).getHigh();

            if (headHigh.compareTo(leftHigh) <= 0 || headHigh.compareTo(rightHigh) <= 0) continue;
            if (!isSimilarPrice(leftHigh, rightHigh, thresholds.getShoulderTolerance())) continue;

            List<Integer> necklineTroughs = between(troughs, leftShoulder, rightShoulder);
            if (necklineTroughs.isEmpty()) continue;

            BigDecimal neckline = min(context.lowsAt(necklineTroughs));
            boolean breakdown = context.latestClose().compareTo(neckline) < 0;
            BigDecimal height = headHigh.subtract(neckline).divide(headHigh, SCALE, RoundingMode.HALF_UP);

            return match(
                breakdown ? 95 : 80,
                breakdown ? "0.85" : "0.65",
                breakdown ? "Neckline broken downward, strong top" : "Top formation in progress",
                "The head stands " + percent(height) + " above the neckline at " + price(neckline) + ". " +
                    (breakdown
                        ? "Price has closed below the neckline, confirming the end of the uptrend."
                        : "A close below the neckline would confirm the reversal."),
                leftShoulder, rightShoulder
            );
        }
        return Optional.empty();
    }
}
