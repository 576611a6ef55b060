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
 * Inverse Head and Shoulders
 *
 * Three consecutive troughs where the middle one (the head) is lower than
 * both shoulders and the shoulders sit at a similar level. The neckline is the
 * highest peak between the shoulders; a close above it confirms the reversal.
 */
public class InverseHeadAndShouldersDetector extends AbstractChartPatternDetector {

    public InverseHeadAndShouldersDetector() {
        super(ChartPatternType.INVERSE_HEAD_AND_SHOULDERS);
    }

    @Override
    protected Optional<ChartPatternMatch> doDetect(PatternContext context) {
        List<Integer> troughs = context.troughs();
        List<Integer> peaks = context.peaks();
        if (troughs.size() < 3 || peaks.size() < 2) {
            return Optional.empty();
        }
        ChartPatternThresholds thresholds = context.getThresholds();

        for (int i = 0; i <= troughs.size() - 3; i++) {
            int leftShoulder = troughs.get(i);
            int head = troughs.get(i + 1);
            int rightShoulder = troughs.get(i + 2);

            BigDecimal leftLow = context.bar(leftShoulder).getLow();
            BigDecimal headLow = context.bar(head).getLow();
            BigDecimal rightLow = context.bar(rightShoulder).getLow();

            if (headLow.compareTo(leftLow) >= 0 || headLow.compareTo(rightLow) >= 0) continue;
            if (!isSimilarPrice(leftLow, rightLow, thresholds.getShoulderTolerance())) continue;

            List<Integer> necklinePeaks = between(peaks, leftShoulder, rightShoulder);
            if (necklinePeaks.isEmpty()) continue;

            BigDecimal neckline = max(context.highsAt(necklinePeaks));
            boolean breakout = context.latestClose().compareTo(neckline) > 0;
            BigDecimal depth = neckline.subtract(headLow).divide(neckline, SCALE, RoundingMode.HALF_UP);

            return match(
                breakout ? 95 : 80,
                breakout ? "0.85" : "0.65",
                breakout ? "Neckline broken upward, strong reversal" : "Bottom formation in progress",
                "The head sits " + percent(depth) + " below the neckline at " + price(neckline) + ". " +
                    (breakout
                        ? "Price has closed above the neckline, confirming the end of the downtrend."
                        : "A close above the neckline would confirm the reversal."),
                leftShoulder, rightShoulder
            );
        }
        return Optional.empty();
    }
}
