package org.stockadvisor.analysis.patterns;

import org.stockadvisor.analysis.model.ChartPatternMatch;
import org.stockadvisor.analysis.model.ChartPatternType;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Base class for chart pattern detectors.
 * Handles the minimum-bar gate and provides the price geometry helpers the
 * concrete detectors share.
 */
public abstract class AbstractChartPatternDetector implements ChartPatternDetector {

    protected static final int SCALE = 8;
    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final BigDecimal TWO = new BigDecimal("2");

    private final ChartPatternType patternType;

    protected AbstractChartPatternDetector(ChartPatternType patternType) {
        this.patternType = patternType;
    }

    @Override
    public ChartPatternType getPatternType() {
        return patternType;
    }

    @Override
    public int getMinimumBars(ChartPatternThresholds thresholds) {
        return thresholds.getStandardMinimumBars();
    }

    @Override
    public final Optional<ChartPatternMatch> detect(PatternContext context) {
        if (context.size() < getMinimumBars(context.getThresholds())) {
            return Optional.empty();
        }
        return doDetect(context);
    }

    /**
     * Detect the formation once the bar count is known to be sufficient.
     */
    protected abstract Optional<ChartPatternMatch> doDetect(PatternContext context);

    // ==================== Helper Methods ====================

    protected Optional<ChartPatternMatch> match(int strength, String confidence, String description,
                                                String explanation, int startIndex, int endIndex) {
        return Optional.of(new ChartPatternMatch(patternType, strength, new BigDecimal(confidence),
            description, explanation, startIndex, endIndex));
    }

    /**
     * Two prices are similar when their difference relative to their average
     * is at most {@code tolerance}.
     */
    protected static boolean isSimilarPrice(BigDecimal a, BigDecimal b, BigDecimal tolerance) {
        BigDecimal average = a.add(b).divide(TWO, SCALE, RoundingMode.HALF_UP);
        if (average.signum() == 0) {
            return a.compareTo(b) == 0;
        }
        BigDecimal diff = a.subtract(b).abs().divide(average, SCALE, RoundingMode.HALF_UP);
        return diff.compareTo(tolerance) <= 0;
    }

    protected static BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            total = total.add(value);
        }
        return total.divide(BigDecimal.valueOf(values.size()), SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Least-squares slope of the values against their position (0, 1, 2, ...).
     */
    protected static BigDecimal slope(List<BigDecimal> values) {
        int n = values.size();
        if (n < 2) {
            return BigDecimal.ZERO;
        }
        BigDecimal xMean = BigDecimal.valueOf(n - 1).divide(TWO, SCALE, RoundingMode.HALF_UP);
        BigDecimal yMean = average(values);

        BigDecimal numerator = BigDecimal.ZERO;
        BigDecimal denominator = BigDecimal.ZERO;
        for (int i = 0; i < n; i++) {
            BigDecimal dx = BigDecimal.valueOf(i).subtract(xMean);
            numerator = numerator.add(dx.multiply(values.get(i).subtract(yMean)));
            denominator = denominator.add(dx.multiply(dx));
        }
        return numerator.divide(denominator, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Slope divided by the average of the fitted values, or null when that average is zero.
     */
    protected static BigDecimal normalizedSlope(List<BigDecimal> values) {
        BigDecimal avg = average(values);
        if (avg.signum() == 0) {
            return null;
        }
        return slope(values).divide(avg, SCALE, RoundingMode.HALF_UP);
    }

    protected static BigDecimal standardDeviation(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal mean = average(values);
        BigDecimal sumSquared = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            BigDecimal diff = value.subtract(mean);
            sumSquared = sumSquared.add(diff.multiply(diff));
        }
        return sumSquared.divide(BigDecimal.valueOf(values.size()), SCALE, RoundingMode.HALF_UP)
            .sqrt(MathContext.DECIMAL64);
    }

    /** (to - from) / from, or zero when from is zero. */
    protected static BigDecimal relativeChange(BigDecimal from, BigDecimal to) {
        if (from.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return to.subtract(from).divide(from, SCALE, RoundingMode.HALF_UP);
    }

    protected static BigDecimal max(List<BigDecimal> values) {
        return Collections.max(values);
    }

    protected static BigDecimal min(List<BigDecimal> values) {
        return Collections.min(values);
    }

    /** Indices strictly between {@code from} and {@code to}. */
    protected static List<Integer> between(List<Integer> indices, int from, int to) {
        return indices.stream().filter(i -> i > from && i < to).collect(Collectors.toList());
    }

    /** First and last bar index covered by the given extrema. */
    protected static int[] span(List<Integer> peaks, List<Integer> troughs) {
        int start = Math.min(peaks.get(0), troughs.get(0));
        int end = Math.max(peaks.get(peaks.size() - 1), troughs.get(troughs.size() - 1));
        return new int[]{start, end};
    }

    /** A ratio formatted as a percentage with one decimal, e.g. {@code 0.0512 -> "5.1%"}. */
    protected static String percent(BigDecimal ratio) {
        return ratio.multiply(HUNDRED).setScale(1, RoundingMode.HALF_UP).toPlainString() + "%";
    }

    protected static String price(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
