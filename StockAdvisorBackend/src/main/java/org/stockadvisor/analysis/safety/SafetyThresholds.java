package org.stockadvisor.analysis.safety;

import org.stockadvisor.analysis.indicators.IndicatorThresholds;
import org.stockadvisor.analysis.model.InvestmentStyle;

import java.math.BigDecimal;

/**
 * Threshold table for the safety rules, one row per investment style.
 *
 * All values are percentages. A null surge threshold disables the surge
 * check for that style.
 */
public class SafetyThresholds {

    private BigDecimal overheatDeviation = IndicatorThresholds.DEVIATION_UPPER;
    private BigDecimal dangerousVolatility = new BigDecimal("50");

    private StyleThresholds conservative = new StyleThresholds(new BigDecimal("30"), new BigDecimal("-20"), false);
    private StyleThresholds balanced = new StyleThresholds(new BigDecimal("40"), new BigDecimal("-15"), false);
    private StyleThresholds aggressive = new StyleThresholds(null, new BigDecimal("-10"), true);
    private StyleThresholds defaultStyle = new StyleThresholds(new BigDecimal("30"), new BigDecimal("-15"), false);

    public StyleThresholds forStyle(InvestmentStyle style) {
        if (style == null) {
            return defaultStyle;
        }
        switch (style) {
            case CONSERVATIVE:
                return conservative;
            case BALANCED:
                return balanced;
            case AGGRESSIVE:
                return aggressive;
            default:
                return defaultStyle;
        }
    }

    public BigDecimal getOverheatDeviation() { return overheatDeviation; }
    public void setOverheatDeviation(BigDecimal overheatDeviation) { this.overheatDeviation = overheatDeviation; }

    public BigDecimal getDangerousVolatility() { return dangerousVolatility; }
    public void setDangerousVolatility(BigDecimal dangerousVolatility) { this.dangerousVolatility = dangerousVolatility; }

    public StyleThresholds getConservative() { return conservative; }
    public void setConservative(StyleThresholds conservative) { this.conservative = conservative; }

    public StyleThresholds getBalanced() { return balanced; }
    public void setBalanced(StyleThresholds balanced) { this.balanced = balanced; }

    public StyleThresholds getAggressive() { return aggressive; }
    public void setAggressive(StyleThresholds aggressive) { this.aggressive = aggressive; }

    // bound from the "default" key
    public StyleThresholds getDefault() { return defaultStyle; }
    public void setDefault(StyleThresholds defaultStyle) { this.defaultStyle = defaultStyle; }

    /**
     * Thresholds for a single investment style.
     */
    public static class StyleThresholds {

        private BigDecimal surgeThreshold;
        private BigDecimal declineThreshold;
        private boolean skipOverheatCheck;

        public StyleThresholds() {
        }

        public StyleThresholds(BigDecimal surgeThreshold, BigDecimal declineThreshold, boolean skipOverheatCheck) {
            this.surgeThreshold = surgeThreshold;
            this.declineThreshold = declineThreshold;
            this.skipOverheatCheck = skipOverheatCheck;
        }

        public BigDecimal getSurgeThreshold() { return surgeThreshold; }
        public void setSurgeThreshold(BigDecimal surgeThreshold) { this.surgeThreshold = surgeThreshold; }

        public BigDecimal getDeclineThreshold() { return declineThreshold; }
        public void setDeclineThreshold(BigDecimal declineThreshold) { this.declineThreshold = declineThreshold; }

        public boolean isSkipOverheatCheck() { return skipOverheatCheck; }
        public void setSkipOverheatCheck(boolean skipOverheatCheck) { this.skipOverheatCheck = skipOverheatCheck; }
    }
}
