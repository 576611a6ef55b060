package org.stockadvisor.analysis.config;

import org.stockadvisor.analysis.patterns.ChartPatternThresholds;
import org.stockadvisor.analysis.safety.SafetyThresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;

/**
 * Overrides for the analysis engine, bound from the {@code analysis.*} keys.
 * Every value defaults to the engine's built-in calibration.
 */
@ConfigurationProperties(prefix = "analysis")
@Validated
public class AnalysisProperties {

    /**
     * Bars older than this many days before the as-of date mark the report as stale.
     */
    @Min(0)
    private int maxDataAgeDays = 7;

    private ChartPatternThresholds patterns = new ChartPatternThresholds();

    private SafetyThresholds safety = new SafetyThresholds();

    public int getMaxDataAgeDays() { return maxDataAgeDays; }
    public void setMaxDataAgeDays(int maxDataAgeDays) { this.maxDataAgeDays = maxDataAgeDays; }

    public ChartPatternThresholds getPatterns() { return patterns; }
    public void setPatterns(ChartPatternThresholds patterns) { this.patterns = patterns; }

    public SafetyThresholds getSafety() { return safety; }
    public void setSafety(SafetyThresholds safety) { this.safety = safety; }
}
