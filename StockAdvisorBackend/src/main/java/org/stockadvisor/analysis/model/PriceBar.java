package org.stockadvisor.analysis.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One daily OHLC price bar.
 *
 * Volume is optional and may be null. The engine never reads it for
 * classification; it is carried so callers can round-trip their data.
 */
public class PriceBar {
    private final LocalDate date;
    private final BigDecimal open;
    private final BigDecimal high;
    private final BigDecimal low;
    private final BigDecimal close;
    private final BigDecimal volume;

    public PriceBar(LocalDate date, BigDecimal open, BigDecimal high, BigDecimal low,
                    BigDecimal close, BigDecimal volume) {
        if (date == null) {
            throw new IllegalArgumentException("Bar date cannot be null");
        }
        if (open == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("Bar " + date + " is missing an OHLC value");
        }
        this.date = date;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    public PriceBar(LocalDate date, BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close) {
        this(date, open, high, low, close, null);
    }

    // Getters
    public LocalDate getDate() { return date; }
    public BigDecimal getOpen() { return open; }
    public BigDecimal getHigh() { return high; }
    public BigDecimal getLow() { return low; }
    public BigDecimal getClose() { return close; }
    public BigDecimal getVolume() { return volume; }

    @Override
    public String toString() {
        return String.format("PriceBar{date=%s, open=%s, high=%s, low=%s, close=%s, volume=%s}",
                date, open, high, low, close, volume);
    }
}
