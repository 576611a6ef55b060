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
 * Bear Flag
 *
 * A sharp drop (the pole) into the middle of the window, followed by a narrow
 * consolidation that drifts sideways or slightly up (the flag).
 */
public class BearFlagDetector extends AbstractChartPatternDetector {

    public BearFlagDetector() {
        super(ChartPatternType.BEAR_FLAG);
    }

    @Override
    protected Optional<ChartPatternMatch> doDetect(PatternContext context) {
        ChartPatternThresholds thresholds = context.getThresholds();
        List<BigDecimal> closes = context.getSeries().closes();
        int n = closes.size();

        int poleEnd = n / 2;
        int poleStart = Math.max(0, poleEnd - thresholds.getPoleLength());
        BigDecimal drop = relativeChange(closes.get(poleStart), closes.get(poleEnd)).negate();
        if (drop.compareTo(thresholds.getPoleMinimumMove()) < 0) {
            return Optional.empty();
        }

        List<BigDecimal> flagCloses = closes.subList(poleEnd, n);
        if (flagCloses.size() < 5) {
            return Optional.empty();
        }
        BigDecimal flagSlope = normalizedSlope(flagCloses);
        if (flagSlope == null ||
            flagSlope.compareTo(thresholds.getFlagMaxSlopeWithPole().negate()) < 0 ||
            flagSlope.compareTo(thresholds.getFlagMaxSlopeAgainstPole()) > 0) {
            return Optional.empty();
        }

        BigDecimal flagRange = BullFlagDetector.flagRange(context, poleEnd, average(flagCloses));
        if (flagRange.compareTo(thresholds.getFlagMaxRange()) > 0) {
            return Optional.empty();
        }

        return match(58, "0.50",
            "Pausing after a sharp fall",
            "Price fell " + percent(drop) + " and is now holding in a " + percent(flagRange) +
                " range. The flag often resolves in the direction of the pole.",
            poleStart, n - 1
        );
    }
}
