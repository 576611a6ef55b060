package org.stockadvisor.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Single-bar candlestick classifications.
 *
 * The description is a two or three word label; the explanation is written
 * for a reader with no charting background and is passed on verbatim.
 */
public enum CandlestickPatternType {

    DOJI("doji", Signal.NEUTRAL, 30,
        "Wait and see",
        "The open and close are almost the same and the market is undecided. Watch for the next move."),

    BULLISH_STRONG("bullish_strong", Signal.BUY, 80,
        "Strong rise",
        "The price rose sharply. Buyers are in control and the rise is likely to continue."),
    BULLISH_HAMMER("bullish_hammer", Signal.BUY, 75,
        "Bottom reversal",
        "The price dipped during the day but buyers pushed it back up. This is a rebound sign."),
    BULLISH_PULLBACK("bullish_pullback", Signal.BUY, 60,
        "Pullback after rise",
        "The price rose and then gave back part of the gain. It may be a chance to buy the dip."),
    BULLISH_SMALL("bullish_small", Signal.BUY, 50,
        "Gradual rise",
        "The price is creeping up. An uptrend may be continuing."),
    BULLISH_NORMAL("bullish_normal", Signal.BUY, 55,
        "Rise",
        "The price went up. Buyers have a slight edge."),

    BEARISH_STRONG("bearish_strong", Signal.SELL, 80,
        "Strong fall",
        "The price fell sharply. Sellers are in control and the fall may continue."),
    BEARISH_REJECTED_RALLY("bearish_rejected_rally", Signal.SELL, 75,
        "Rejected rally",
        "The price rose during the day but sellers pushed it back down. This is a sign of further decline."),
    BEARISH_SLIP("bearish_slip", Signal.SELL, 65,
        "Slip from the high",
        "Buyers supported the price at the low, but it still closed lower. This is a weak sign."),
    BEARISH_SMALL("bearish_small", Signal.SELL, 50,
        "Gradual fall",
        "The price is edging down. This may be the start of a downtrend, so be careful."),
    BEARISH_NORMAL("bearish_normal", Signal.SELL, 55,
        "Fall",
        "The price went down. Sellers have a slight edge.");

    private final String id;
    private final Signal signal;
    private final int strength;
    private final String description;
    private final String explanation;

    CandlestickPatternType(String id, Signal signal, int strength, String description, String explanation) {
        this.id = id;
        this.signal = signal;
        this.strength = strength;
        this.description = description;
        this.explanation = explanation;
    }

    @JsonValue
    public String getId() { return id; }
    public Signal getSignal() { return signal; }
    public int getStrength() { return strength; }
    public String getDescription() { return description; }
    public String getExplanation() { return explanation; }
}
