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
 * Box Range
 *
 * Peaks and troughs each clustered around a flat level, with a band width
 * that is neither too tight nor too wide to trade.
 */
public class BoxRangeDetector extends AbstractChartPatternDetector {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    public BoxRangeDetector() {
        super(ChartPatternType.BOX_RANGE);
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
        BigDecimal top = average(peakHighs);
        BigDecimal bottom = average(troughLows);
        if (top.signum() <= 0 || bottom.signum() <= 0 || top.compareTo(bottom) <= 0) {
            return Optional.empty();
        }

        BigDecimal peakSpread = standardDeviation(peakHighs).divide(top, SCALE, RoundingMode.HALF_UP);
        BigDecimal troughSpread = standardDeviation(troughLows).divide(bottom, SCALE, RoundingMode.HALF_UP);
        if (peakSpread.compareTo(thresholds.getBoxMaxFlatness()) > 0 ||
            troughSpread.compareTo(thresholds.getBoxMaxFlatness()) > 0) {
            return Optional.empty();
        }

        BigDecimal width = relativeChange(bottom, top);
        if (width.compareTo(thresholds.getBoxMinimumRange()) < 0 ||
            width.compareTo(thresholds.getBoxMaximumRange()) > 0) {
            return Optional.empty();
        }

        BigDecimal position = context.latestClose().subtract(bottom)
            .divide(top.subtract(bottom), SCALE, RoundingMode.HALF_UP)
            .multiply(HUNDRED)
            .setScale(0, RoundingMode.HALF_UP);
        int[] span = span(peaks, troughs);

        return match(55, "0.55",
            "Trading inside a range",
            "Price is moving between " + price(bottom) + " and " + price(top) + " (" + percent(width) +
                " wide) and currently sits at " + position.toPlainString() + "% of the range.",
            span[0], span[1]
        );
    }
}
