package org.stockadvisor.analysis;

import org.stockadvisor.analysis.model.PriceBar;
import org.stockadvisor.analysis.model.PriceSeries;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Synthetic daily series for engine tests.
 */
public final class PriceSeriesFixtures {

    public static final LocalDate START = LocalDate.of(2024, 1, 1);

    private PriceSeriesFixtures() {
    }

    public static BigDecimal bd(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }

    public static PriceBar createBar(LocalDate date, double open, double high, double low, double close) {
        return new PriceBar(date, bd(open), bd(high), bd(low), bd(close), bd(1_000_000));
    }

    /**
     * One bar per close, one calendar day apart, with open = close and
     * high/low half a point either side.
     */
    public static PriceSeries fromCloses(double... closes) {
        List<PriceBar> bars = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            double c = closes[i];
            bars.add(createBar(START.plusDays(i), c, c + 0.5, c - 0.5, c));
        }
        return PriceSeries.oldestFirst(bars);
    }

    public static List<BigDecimal> prices(double... values) {
        List<BigDecimal> list = new ArrayList<>();
        for (double value : values) {
            list.add(bd(value));
        }
        return list;
    }

    /**
     * Piecewise-linear closes through {index, price} anchors; the first anchor must be index 0.
     */
    public static double[] segments(double[][] anchors) {
        int last = (int) anchors[anchors.length - 1][0];
        double[] closes = new double[last + 1];
        closes[0] = anchors[0][1];
        for (int a = 1; a < anchors.length; a++) {
            int i0 = (int) anchors[a - 1][0];
            int i1 = (int) anchors[a][0];
            double v0 = anchors[a - 1][1];
            double v1 = anchors[a][1];
            for (int i = i0 + 1; i <= i1; i++) {
                closes[i] = v0 + (v1 - v0) * (i - i0) / (i1 - i0);
            }
        }
        return closes;
    }

    public static double[] constant(int count, double value) {
        double[] closes = new double[count];
        Arrays.fill(closes, value);
        return closes;
    }

    public static double[] linear(int count, double from, double step) {
        double[] closes = new double[count];
        for (int i = 0; i < count; i++) {
            closes[i] = from + i * step;
        }
        return closes;
    }

    public static double[] randomWalk(int count, double start, long seed) {
        Random random = new Random(seed);
        double[] closes = new double[count];
        double price = start;
        for (int i = 0; i < count; i++) {
            price = Math.max(1.0, price + (random.nextDouble() - 0.5) * 4.0);
            closes[i] = price;
        }
        return closes;
    }

    /** Falls to a low, rallies, retests the low and breaks out above the middle peak. */
    public static double[] doubleBottom() {
        return segments(new double[][]{{0, 110}, {7, 100}, {12, 108}, {18, 100.5}, {29, 112}});
    }

    /** Three peaks with a higher middle one, finishing below the neckline. */
    public static double[] headAndShoulders() {
        return segments(new double[][]{{0, 100}, {5, 105}, {10, 100}, {15, 110}, {20, 100}, {25, 105}, {32, 97}});
    }
}
