package org.stockadvisor.analysis.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable, chronologically ordered (oldest first) price series.
 *
 * This is the only place where ordering is reconciled: data arriving
 * newest-first is reversed once in {@link #newestFirst(List)} and every
 * calculation downstream reads index 0 as the oldest bar and
 * {@code size() - 1} as the latest. The series does not sort or validate
 * the order of what it is given.
 */
public final class PriceSeries {

    private final List<PriceBar> bars;

    private PriceSeries(List<PriceBar> bars) {
        this.bars = Collections.unmodifiableList(bars);
    }

    /**
     * Wrap bars that are already oldest-first.
     */
    public static PriceSeries oldestFirst(List<PriceBar> bars) {
        return new PriceSeries(copyOf(bars));
    }

    /**
     * Wrap bars delivered newest-first (the order most quote stores return them in).
     */
    public static PriceSeries newestFirst(List<PriceBar> bars) {
        List<PriceBar> copy = copyOf(bars);
        Collections.reverse(copy);
        return new PriceSeries(copy);
    }

    public static PriceSeries empty() {
        return new PriceSeries(new ArrayList<>());
    }

    private static List<PriceBar> copyOf(List<PriceBar> bars) {
        if (bars == null) {
            throw new IllegalArgumentException("Price bars cannot be null");
        }
        List<PriceBar> copy = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) {
            if (bar == null) {
                throw new IllegalArgumentException("Price series cannot contain null bars");
            }
            copy.add(bar);
        }
        return copy;
    }

    public List<PriceBar> getBars() {
        return bars;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public PriceBar get(int index) {
        return bars.get(index);
    }

    /**
     * @return the latest bar, or null for an empty series
     */
    public PriceBar latest() {
        return bars.isEmpty() ? null : bars.get(bars.size() - 1);
    }

    /**
     * Closing prices, oldest first.
     */
    public List<BigDecimal> closes() {
        return bars.stream().map(PriceBar::getClose).collect(Collectors.toList());
    }

    /**
     * The last {@code count} bars (or all of them when the series is shorter).
     */
    public PriceSeries tail(int count) {
        if (count >= bars.size()) {
            return this;
        }
        return new PriceSeries(new ArrayList<>(bars.subList(bars.size() - Math.max(0, count), bars.size())));
    }

    /**
     * Drop every bar dated after {@code asOf}. The caller supplies the
     * reference date; nothing here reads the clock.
     */
    public PriceSeries upTo(LocalDate asOf) {
        if (asOf == null) {
            return this;
        }
        List<PriceBar> kept = bars.stream()
            .filter(bar -> !bar.getDate().isAfter(asOf))
            .collect(Collectors.toList());
        return kept.size() == bars.size() ? this : new PriceSeries(kept);
    }

    @Override
    public String toString() {
        return "PriceSeries{size=" + bars.size() +
            (bars.isEmpty() ? "" : ", from=" + bars.get(0).getDate() + ", to=" + latest().getDate()) + "}";
    }
}
