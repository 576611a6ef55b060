package org.stockadvisor.analysis.patterns;

import org.stockadvisor.analysis.model.PriceBar;
import org.stockadvisor.analysis.model.PriceSeries;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Input shared by every detector in one registry run: the series, its
 * extrema (computed once) and the calibration thresholds.
 */
public final class PatternContext {

    private final PriceSeries series;
    private final PriceExtrema extrema;
    private final ChartPatternThresholds thresholds;

    public PatternContext(PriceSeries series, PriceExtrema extrema, ChartPatternThresholds thresholds) {
        this.series = series;
        this.extrema = extrema;
        this.thresholds = thresholds;
    }

    public static PatternContext of(PriceSeries series, ChartPatternThresholds thresholds) {
        return new PatternContext(series, PriceExtrema.find(series, thresholds.getExtremaWindow()), thresholds);
    }

    public PriceSeries getSeries() { return series; }
    public PriceExtrema getExtrema() { return extrema; }
    public ChartPatternThresholds getThresholds() { return thresholds; }

    public int size() {
        return series.size();
    }

    public PriceBar bar(int index) {
        return series.get(index);
    }

    public List<Integer> peaks() {
        return extrema.getPeaks();
    }

    public List<Integer> troughs() {
        return extrema.getTroughs();
    }

    public BigDecimal latestClose() {
        return series.latest().getClose();
    }

    /** Highs at the given bar indices. */
    public List<BigDecimal> highsAt(List<Integer> indices) {
        return indices.stream().map(i -> series.get(i).getHigh()).collect(Collectors.toList());
    }

    /** Lows at the given bar indices. */
    public List<BigDecimal> lowsAt(List<Integer> indices) {
        return indices.stream().map(i -> series.get(i).getLow()).collect(Collectors.toList());
    }
}
