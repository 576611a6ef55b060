package org.stockadvisor.analysis.patterns.impl;

import org.stockadvisor.analysis.model.ChartPatternMatch;
import org.stockadvisor.analysis.model.ChartPatternType;
import org.stockadvisor.analysis.patterns.AbstractChartPatternDetector;
import org.stockadvisor.analysis.patterns.PatternContext;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Symmetrical Triangle
 *
 * Falling peaks and rising troughs converging towards each other. The
 * breakout direction is not implied, so the pattern is neutral.
 */
public class SymmetricalTriangleDetector extends AbstractChartPatternDetector {

    public SymmetricalTriangleDetector() {
        super(ChartPatternType.SYMMETRICAL_TRIANGLE);
    }

    @Override
    protected Optional<ChartPatternMatch> doDetect(PatternContext context) {
        List<Integer> peaks = context.peaks();
        List<Integer> troughs = context.troughs();
        if (peaks.size() < 2 || troughs.size() < 2) {
            return Optional.empty();
        }
        BigDecimal convergence = context.getThresholds().getConvergenceSlope();

        List<BigDecimal> peakHighs = context.highsAt(peaks);
        List<BigDecimal> troughLows = context.lowsAt(troughs);
        BigDecimal peakSlope = normalizedSlope(peakHighs);
        BigDecimal troughSlope = normalizedSlope(troughLows);
        if (peakSlope == null || troughSlope == null) {
            return Optional.empty();
        }

        if (peakSlope.compareTo(convergence.negate()) >= 0) return Optional.empty();
        if (troughSlope.compareTo(convergence) <= 0) return Optional.empty();

        BigDecimal initialRange = peakHighs.get(0).subtract(troughLows.get(0));
        BigDecimal latestRange = peakHighs.get(peakHighs.size() - 1).subtract(troughLows.get(troughLows.size() - 1));
        String narrowing = initialRange.signum() > 0
            ? "The range has narrowed to " + percent(latestRange.divide(initialRange, SCALE, RoundingMode.HALF_UP)) +
                " of its initial width. "
            : "";
        int[] span = span(peaks, troughs);

        return match(55, "0.52",
            "Converging range, breakout pending",
            "Highs are falling and lows are rising. " + narrowing +
                "A breakout can go either way, so wait for direction.",
            span[0], span[1]
        );
    }
}
