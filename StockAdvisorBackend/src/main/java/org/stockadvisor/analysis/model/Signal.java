package org.stockadvisor.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Directional classification shared by candlesticks, chart patterns and the combined signal.
 */
public enum Signal {
    BUY("buy"),
    SELL("sell"),
    NEUTRAL("neutral");

    private final String value;

    Signal(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
