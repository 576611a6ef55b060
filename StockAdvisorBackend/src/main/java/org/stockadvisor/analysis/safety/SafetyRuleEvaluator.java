package org.stockadvisor.analysis.safety;

import org.stockadvisor.analysis.model.InvestmentStyle;
import org.stockadvisor.analysis.model.RiskMetrics;
import org.stockadvisor.analysis.model.SafetyFlags;

import java.math.BigDecimal;

/**
 * Safety Rule Evaluator
 *
 * Boolean predicates over derived metrics. They only classify; deciding what
 * to do about a raised flag (for example downgrading a buy to a hold) is left
 * to the caller. A missing metric never raises a flag.
 */
public class SafetyRuleEvaluator {

    private final SafetyThresholds thresholds;

    public SafetyRuleEvaluator() {
        this(new SafetyThresholds());
    }

    public SafetyRuleEvaluator(SafetyThresholds thresholds) {
        if (thresholds == null) {
            throw new IllegalArgumentException("Thresholds cannot be null");
        }
        this.thresholds = thresholds;
    }

    /**
     * Week-over-week rise at or above the style's surge threshold.
     * Always false for a style without a surge threshold.
     */
    public boolean isSurgeStock(BigDecimal weekChangeRate, InvestmentStyle style) {
        BigDecimal threshold = thresholds.forStyle(style).getSurgeThreshold();
        if (weekChangeRate == null || threshold == null) {
            return false;
        }
        return weekChangeRate.compareTo(threshold) >= 0;
    }

    /**
     * Loss-making and highly volatile. An unknown profitability is not treated as a loss.
     */
    public boolean isDangerousStock(Boolean isProfitable, BigDecimal volatility) {
        if (!Boolean.FALSE.equals(isProfitable) || volatility == null) {
            return false;
        }
        return volatility.compareTo(thresholds.getDangerousVolatility()) > 0;
    }

    public boolean isOverheated(BigDecimal deviationRate, InvestmentStyle style) {
        if (deviationRate == null || thresholds.forStyle(style).isSkipOverheatCheck()) {
            return false;
        }
        return deviationRate.compareTo(thresholds.getOverheatDeviation()) >= 0;
    }

    public boolean isInDecline(BigDecimal weekChangeRate, InvestmentStyle style) {
        BigDecimal threshold = thresholds.forStyle(style).getDeclineThreshold();
        if (weekChangeRate == null || threshold == null) {
            return false;
        }
        return weekChangeRate.compareTo(threshold) <= 0;
    }

    /**
     * Evaluate every rule at once.
     */
    public SafetyFlags evaluate(RiskMetrics metrics, InvestmentStyle style) {
        if (metrics == null) {
            throw new IllegalArgumentException("Metrics cannot be null");
        }
        return new SafetyFlags(
            isSurgeStock(metrics.getWeekChangeRate(), style),
            isDangerousStock(metrics.getProfitable(), metrics.getVolatility()),
            isOverheated(metrics.getDeviationRate(), style),
            isInDecline(metrics.getWeekChangeRate(), style)
        );
    }
}
