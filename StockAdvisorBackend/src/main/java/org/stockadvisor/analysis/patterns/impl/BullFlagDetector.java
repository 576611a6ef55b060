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
 * Bull Flag
 *
 * A sharp rise (the pole) into the middle of the window, followed by a narrow
 * consolidation that drifts sideways or slightly down (the flag).
 */
public class BullFlagDetector extends AbstractChartPatternDetector {

    public BullFlagDetector() {
        super(ChartPatternType.BULL_FLAG);
    }

    @Override
    protected Optional<ChartPatternMatch> doDetect(PatternContext context) {
        ChartPatternThresholds thresholds = context.getThresholds();
        List<BigDecimal> closes = context.getSeries().closes();
        int n = closes.size();

        int poleEnd = n / 2;
        int poleStart = Math.max(0, poleEnd - thresholds.getPoleLength());
        BigDecimal rise = relativeChange(closes.get(poleStart), closes.get(poleEnd));
        if (rise.compareTo(thresholds.getPoleMinimumMove()) < 0) {
            return Optional.empty();
        }

        List<BigDecimal> flagCloses = closes.subList(poleEnd, n);
        if (flagCloses.size() < 5) {
            return Optional.empty();
        }
        BigDecimal flagSlope = normalizedSlope(flagCloses);
        if (flagSlope == null ||
            flagSlope.compareTo(thresholds.getFlagMaxSlopeWithPole()) > 0 ||
            flagSlope.compareTo(thresholds.getFlagMaxSlopeAgainstPole().negate()) < 0) {
            return Optional.empty();
        }

        BigDecimal flagRange = flagRange(context, poleEnd, average(flagCloses));
        if (flagRange.compareTo(thresholds.getFlagMaxRange()) > 0) {
            return Optional.empty();
        }

        return match(58, "0.50",
            "Consolidating after a sharp rise",
            "Price rose " + percent(rise) + " and is now pausing in a " + percent(flagRange) +
                " range. The flag often resolves in the direction of the pole.",
            poleStart, n - 1
        );
    }

    static BigDecimal flagRange(PatternContext context, int from, BigDecimal averageClose) {
        BigDecimal high = context.bar(from).getHigh();
        BigDecimal low = context.bar(from).getLow();
        for (int i = from + 1; i < context.size(); i++) {
            high = high.max(context.bar(i).getHigh());
            low = low.min(context.bar(i).getLow());
        }
        return high.subtract(low).divide(averageClose, SCALE, RoundingMode.HALF_UP);
    }
}
