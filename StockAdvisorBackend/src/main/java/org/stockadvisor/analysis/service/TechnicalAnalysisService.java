package org.stockadvisor.analysis.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stockadvisor.analysis.candlestick.CandlestickClassifier;
import org.stockadvisor.analysis.config.AnalysisProperties;
import org.stockadvisor.analysis.indicators.MarketMetrics;
import org.stockadvisor.analysis.indicators.TechnicalIndicators;
import org.stockadvisor.analysis.model.CandleSignal;
import org.stockadvisor.analysis.model.CandlestickPattern;
import org.stockadvisor.analysis.model.CandlestickSummary;
import org.stockadvisor.analysis.model.ChartPatternMatch;
import org.stockadvisor.analysis.model.CombinedSignal;
import org.stockadvisor.analysis.model.IndicatorSet;
import org.stockadvisor.analysis.model.InvestmentStyle;
import org.stockadvisor.analysis.model.PriceSeries;
import org.stockadvisor.analysis.model.RiskMetrics;
import org.stockadvisor.analysis.model.SafetyFlags;
import org.stockadvisor.analysis.model.TechnicalAnalysisReport;
import org.stockadvisor.analysis.model.TrendScore;
import org.stockadvisor.analysis.patterns.ChartPatternRegistry;
import org.stockadvisor.analysis.safety.SafetyRuleEvaluator;
import org.stockadvisor.analysis.signal.SignalCombiner;
import org.stockadvisor.analysis.signal.TrendScorer;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Technical Analysis Service
 * Runs the whole engine over one price series and assembles the report.
 *
 * The as-of date is always supplied by the caller; the service never reads
 * the clock. Bars dated after it are ignored.
 */
@Service
public class TechnicalAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(TechnicalAnalysisService.class);

    private final ChartPatternRegistry patternRegistry;
    private final SafetyRuleEvaluator safetyEvaluator;
    private final int maxDataAgeDays;

    public TechnicalAnalysisService(ChartPatternRegistry patternRegistry,
                                    SafetyRuleEvaluator safetyEvaluator,
                                    AnalysisProperties properties) {
        this.patternRegistry = patternRegistry;
        this.safetyEvaluator = safetyEvaluator;
        this.maxDataAgeDays = properties.getMaxDataAgeDays();
    }

    /**
     * @param series oldest-first bars
     * @param asOf analysis date; null means the date of the latest bar
     * @param style investor profile for the safety thresholds; null means {@link InvestmentStyle#DEFAULT}
     * @param profitable whether the company is profitable; null when unknown
     */
    public TechnicalAnalysisReport analyze(PriceSeries series, LocalDate asOf,
                                           InvestmentStyle style, Boolean profitable) {
        if (series == null) {
            throw new IllegalArgumentException("Series cannot be null");
        }
        InvestmentStyle effectiveStyle = style != null ? style : InvestmentStyle.DEFAULT;
        PriceSeries window = series.upTo(asOf);

        LocalDate latestDate = window.isEmpty() ? null : window.latest().getDate();
        LocalDate effectiveAsOf = asOf != null ? asOf : latestDate;
        boolean stale = isStale(latestDate, effectiveAsOf);

        log.debug("Analysing {} bars (of {}) as of {} for style {}",
            window.size(), series.size(), effectiveAsOf, effectiveStyle.getTag());
        if (stale) {
            log.warn("Latest bar {} is more than {} days older than {}", latestDate, maxDataAgeDays, effectiveAsOf);
        }

        IndicatorSet indicators = TechnicalIndicators.calculateIndicatorSet(window);
        CandlestickPattern latestCandle = window.isEmpty() ? null : CandlestickClassifier.classify(window.latest());
        CandlestickSummary candleSummary =
            CandlestickClassifier.summarize(window, CandlestickClassifier.DEFAULT_SUMMARY_LOOKBACK);
        List<CandleSignal> recentSignals =
            CandlestickClassifier.recentSignals(window, CandlestickClassifier.DEFAULT_MAX_SIGNALS);
        List<ChartPatternMatch> patterns = patternRegistry.detect(window);
        CombinedSignal combined = SignalCombiner.combine(latestCandle, indicators);
        TrendScore trend = TrendScorer.score(window);

        RiskMetrics metrics = new RiskMetrics(
            MarketMetrics.weekChangeRate(window),
            MarketMetrics.volatility(window),
            indicators.getDeviationRate(),
            profitable
        );
        SafetyFlags safety = safetyEvaluator.evaluate(metrics, effectiveStyle);

        log.debug("Found {} chart patterns, combined signal {} ({})",
            patterns.size(), combined.getSignal().getValue(), combined.getStrength());
        if (safety.anyRaised()) {
            log.info("Safety flags raised as of {}: {}", effectiveAsOf, safety);
        }

        return new TechnicalAnalysisReport(effectiveAsOf, latestDate, stale, window.size(),
            indicators, latestCandle, candleSummary, recentSignals, patterns,
            combined, trend, metrics, safety);
    }

    private boolean isStale(LocalDate latestDate, LocalDate asOf) {
        if (latestDate == null) {
            return true;
        }
        return latestDate.isBefore(asOf.minusDays(maxDataAgeDays));
    }

    public ChartPatternRegistry getPatternRegistry() {
        return patternRegistry;
    }
}
