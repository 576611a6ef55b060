package org.stockadvisor.analysis.patterns;

import java.math.BigDecimal;

/**
 * Calibration values for chart pattern detection.
 *
 * Ratios are fractions (0.05 = 5%). Slopes are least-squares slopes per bar
 * divided by the average of the fitted prices. Every value has a default and
 * can be overridden through the {@code analysis.patterns} configuration.
 */
public class ChartPatternThresholds {

    // ==================== Extrema & Bar Counts ====================

    private int extremaWindow = 2;
    private int registryMinimumBars = 10;
    private int standardMinimumBars = 15;
    private int doublePatternMinimumBars = 10;
    private int triplePatternMinimumBars = 20;

    // ==================== Level Matching ====================

    private BigDecimal shoulderTolerance = new BigDecimal("0.05");
    private BigDecimal levelTolerance = new BigDecimal("0.04");
    private int minimumDoubleSeparation = 5;

    // ==================== Triangles ====================

    private BigDecimal flatSlope = new BigDecimal("0.003");
    private BigDecimal trendSlope = new BigDecimal("0.001");
    private BigDecimal convergenceSlope = new BigDecimal("0.0005");

    // ==================== Flags ====================

    private BigDecimal poleMinimumMove = new BigDecimal("0.05");
    private int poleLength = 10;
    private BigDecimal flagMaxSlopeWithPole = new BigDecimal("0.001");
    private BigDecimal flagMaxSlopeAgainstPole = new BigDecimal("0.005");
    private BigDecimal flagMaxRange = new BigDecimal("0.10");

    // ==================== Box Range ====================

    private BigDecimal boxMaxFlatness = new BigDecimal("0.03");
    private BigDecimal boxMinimumRange = new BigDecimal("0.03");
    private BigDecimal boxMaximumRange = new BigDecimal("0.15");

    public int getExtremaWindow() { return extremaWindow; }
    public void setExtremaWindow(int extremaWindow) { this.extremaWindow = extremaWindow; }

    public int getRegistryMinimumBars() { return registryMinimumBars; }
    public void setRegistryMinimumBars(int registryMinimumBars) { this.registryMinimumBars = registryMinimumBars; }

    public int getStandardMinimumBars() { return standardMinimumBars; }
    public void setStandardMinimumBars(int standardMinimumBars) { this.standardMinimumBars = standardMinimumBars; }

    public int getDoublePatternMinimumBars() { return doublePatternMinimumBars; }
    public void setDoublePatternMinimumBars(int doublePatternMinimumBars) {
        this.doublePatternMinimumBars = doublePatternMinimumBars;
    }

    public int getTriplePatternMinimumBars() { return triplePatternMinimumBars; }
    public void setTriplePatternMinimumBars(int triplePatternMinimumBars) {
        this.triplePatternMinimumBars = triplePatternMinimumBars;
    }

    public BigDecimal getShoulderTolerance() { return shoulderTolerance; }
    public void setShoulderTolerance(BigDecimal shoulderTolerance) { this.shoulderTolerance = shoulderTolerance; }

    public BigDecimal getLevelTolerance() { return levelTolerance; }
    public void setLevelTolerance(BigDecimal levelTolerance) { this.levelTolerance = levelTolerance; }

    public int getMinimumDoubleSeparation() { return minimumDoubleSeparation; }
    public void setMinimumDoubleSeparation(int minimumDoubleSeparation) {
        this.minimumDoubleSeparation = minimumDoubleSeparation;
    }

    public BigDecimal getFlatSlope() { return flatSlope; }
    public void setFlatSlope(BigDecimal flatSlope) { this.flatSlope = flatSlope; }

    public BigDecimal getTrendSlope() { return trendSlope; }
    public void setTrendSlope(BigDecimal trendSlope) { this.trendSlope = trendSlope; }

    public BigDecimal getConvergenceSlope() { return convergenceSlope; }
    public void setConvergenceSlope(BigDecimal convergenceSlope) { this.convergenceSlope = convergenceSlope; }

    public BigDecimal getPoleMinimumMove() { return poleMinimumMove; }
    public void setPoleMinimumMove(BigDecimal poleMinimumMove) { this.poleMinimumMove = poleMinimumMove; }

    public int getPoleLength() { return poleLength; }
    public void setPoleLength(int poleLength) { this.poleLength = poleLength; }

    public BigDecimal getFlagMaxSlopeWithPole() { return flagMaxSlopeWithPole; }
    public void setFlagMaxSlopeWithPole(BigDecimal flagMaxSlopeWithPole) {
        this.flagMaxSlopeWithPole = flagMaxSlopeWithPole;
    }

    public BigDecimal getFlagMaxSlopeAgainstPole() { return flagMaxSlopeAgainstPole; }
    public void setFlagMaxSlopeAgainstPole(BigDecimal flagMaxSlopeAgainstPole) {
        this.flagMaxSlopeAgainstPole = flagMaxSlopeAgainstPole;
    }

    public BigDecimal getFlagMaxRange() { return flagMaxRange; }
    public void setFlagMaxRange(BigDecimal flagMaxRange) { this.flagMaxRange = flagMaxRange; }

    public BigDecimal getBoxMaxFlatness() { return boxMaxFlatness; }
    public void setBoxMaxFlatness(BigDecimal boxMaxFlatness) { this.boxMaxFlatness = boxMaxFlatness; }

    public BigDecimal getBoxMinimumRange() { return boxMinimumRange; }
    public void setBoxMinimumRange(BigDecimal boxMinimumRange) { this.boxMinimumRange = boxMinimumRange; }

    public BigDecimal getBoxMaximumRange() { return boxMaximumRange; }
    public void setBoxMaximumRange(BigDecimal boxMaximumRange) { this.boxMaximumRange = boxMaximumRange; }
}
