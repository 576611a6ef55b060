package org.stockadvisor.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.List;

/**
 * Coarse trend verdict from RSI, the 25-day SMA and the MACD histogram.
 */
public final class TrendScore {

    public enum Label {
        STRONG_BUY("strong_buy"),
        BUY("buy"),
        NEUTRAL("neutral"),
        SELL("sell"),
        STRONG_SELL("strong_sell");

        private final String value;

        Label(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    private final BigDecimal score;
    private final Label label;
    private final List<String> reasons;

    public TrendScore(BigDecimal score, Label label, List<String> reasons) {
        this.score = score;
        this.label = label;
        this.reasons = List.copyOf(reasons);
    }

    public BigDecimal getScore() { return score; }
    public Label getLabel() { return label; }
    public List<String> getReasons() { return reasons; }

    @Override
    public String toString() {
        return "TrendScore{score=" + score + ", label=" + label + ", reasons=" + reasons + "}";
    }
}
