package org.stockadvisor.analysis.model;

/**
 * Latest candlestick plus how many notable buy and sell candles appeared in
 * the last few bars.
 */
public final class CandlestickSummary {
    private final CandlestickPattern latest;
    private final int lookback;
    private final int buySignals;
    private final int sellSignals;

    public CandlestickSummary(CandlestickPattern latest, int lookback, int buySignals, int sellSignals) {
        this.latest = latest;
        this.lookback = lookback;
        this.buySignals = buySignals;
        this.sellSignals = sellSignals;
    }

    public CandlestickPattern getLatest() { return latest; }
    public int getLookback() { return lookback; }
    public int getBuySignals() { return buySignals; }
    public int getSellSignals() { return sellSignals; }

    @Override
    public String toString() {
        return "CandlestickSummary{latest=" + latest + ", lookback=" + lookback +
            ", buySignals=" + buySignals + ", sellSignals=" + sellSignals + "}";
    }
}
