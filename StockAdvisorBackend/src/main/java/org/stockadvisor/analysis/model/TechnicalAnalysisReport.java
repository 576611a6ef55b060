package org.stockadvisor.analysis.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything the engine derives from one price series, as handed to the
 * prompt and recommendation layers.
 */
public final class TechnicalAnalysisReport {

    private final LocalDate asOf;
    private final LocalDate latestDate;
    private final boolean stale;
    private final int barCount;
    private final IndicatorSet indicators;
    private final CandlestickPattern latestCandle;
    private final CandlestickSummary candleSummary;
    private final List<CandleSignal> recentCandleSignals;
    private final List<ChartPatternMatch> chartPatterns;
    private final CombinedSignal combined;
    private final TrendScore trend;
    private final RiskMetrics metrics;
    private final SafetyFlags safety;

    public TechnicalAnalysisReport(LocalDate asOf, LocalDate latestDate, boolean stale, int barCount,
                                   IndicatorSet indicators, CandlestickPattern latestCandle,
                                   CandlestickSummary candleSummary, List<CandleSignal> recentCandleSignals,
                                   List<ChartPatternMatch> chartPatterns, CombinedSignal combined,
                                   TrendScore trend, RiskMetrics metrics, SafetyFlags safety) {
        this.asOf = asOf;
        this.latestDate = latestDate;
        this.stale = stale;
        this.barCount = barCount;
        this.indicators = indicators;
        this.latestCandle = latestCandle;
        this.candleSummary = candleSummary;
        this.recentCandleSignals = List.copyOf(recentCandleSignals);
        this.chartPatterns = List.copyOf(chartPatterns);
        this.combined = combined;
        this.trend = trend;
        this.metrics = metrics;
        this.safety = safety;
    }

    public LocalDate getAsOf() { return asOf; }
    public LocalDate getLatestDate() { return latestDate; }
    public boolean isStale() { return stale; }
    public int getBarCount() { return barCount; }
    public IndicatorSet getIndicators() { return indicators; }
    public CandlestickPattern getLatestCandle() { return latestCandle; }
    public CandlestickSummary getCandleSummary() { return candleSummary; }
    public List<CandleSignal> getRecentCandleSignals() { return recentCandleSignals; }
    public List<ChartPatternMatch> getChartPatterns() { return chartPatterns; }
    public CombinedSignal getCombined() { return combined; }
    public TrendScore getTrend() { return trend; }
    public RiskMetrics getMetrics() { return metrics; }
    public SafetyFlags getSafety() { return safety; }
}
