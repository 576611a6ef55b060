package org.stockadvisor.analysis.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A notable candlestick in the recent history of a series (strength of 60 or more).
 */
public final class CandleSignal {
    private final LocalDate date;
    private final CandlestickPatternType pattern;
    private final Signal signal;
    private final BigDecimal price;
    private final int strength;

    public CandleSignal(LocalDate date, CandlestickPatternType pattern, BigDecimal price) {
        this.date = date;
        this.pattern = pattern;
        this.signal = pattern.getSignal();
        this.price = price;
        this.strength = pattern.getStrength();
    }

    public LocalDate getDate() { return date; }
    public CandlestickPatternType getPattern() { return pattern; }
    public Signal getSignal() { return signal; }
    public BigDecimal getPrice() { return price; }
    public int getStrength() { return strength; }

    @Override
    public String toString() {
        return "CandleSignal{date=" + date + ", pattern=" + pattern.getId() + ", price=" + price + "}";
    }
}
