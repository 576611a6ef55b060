package org.stockadvisor.analysis.patterns;

import org.stockadvisor.analysis.model.PriceSeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Local peaks and troughs of a series.
 *
 * Bar {@code i} is a peak when its high is strictly greater than the high of
 * every bar within {@code window} bars on both sides, and a trough when its
 * low is strictly lower than every neighbouring low. Bars closer than
 * {@code window} to either end are never extrema. Indices are ascending.
 */
public final class PriceExtrema {

    private final List<Integer> peaks;
    private final List<Integer> troughs;

    private PriceExtrema(List<Integer> peaks, List<Integer> troughs) {
        this.peaks = Collections.unmodifiableList(peaks);
        this.troughs = Collections.unmodifiableList(troughs);
    }

    public static PriceExtrema find(PriceSeries series, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("Extrema window must be positive: " + window);
        }
        List<Integer> peaks = new ArrayList<>();
        List<Integer> troughs = new ArrayList<>();

        for (int i = window; i < series.size() - window; i++) {
            boolean isPeak = true;
            boolean isTrough = true;

            for (int j = 1; j <= window && (isPeak || isTrough); j++) {
                if (series.get(i).getHigh().compareTo(series.get(i - j).getHigh()) <= 0 ||
                    series.get(i).getHigh().compareTo(series.get(i + j).getHigh()) <= 0) {
                    isPeak = false;
                }
                if (series.get(i).getLow().compareTo(series.get(i - j).getLow()) >= 0 ||
                    series.get(i).getLow().compareTo(series.get(i + j).getLow()) >= 0) {
                    isTrough = false;
                }
            }

            if (isPeak) peaks.add(i);
            if (isTrough) troughs.add(i);
        }

        return new PriceExtrema(peaks, troughs);
    }

    public List<Integer> getPeaks() {
        return peaks;
    }

    public List<Integer> getTroughs() {
        return troughs;
    }

    @Override
    public String toString() {
        return "PriceExtrema{peaks=" + peaks + ", troughs=" + troughs + "}";
    }
}
