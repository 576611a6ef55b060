package org.stockadvisor.analysis.patterns;

import org.stockadvisor.analysis.model.ChartPatternMatch;
import org.stockadvisor.analysis.model.ChartPatternType;

import java.util.Optional;

/**
 * A single multi-bar chart formation detector.
 *
 * Detectors are independent of each other and of the order they run in.
 * Each one reads the shared {@link PatternContext} (bars, peaks, troughs and
 * thresholds) and either reports one match or nothing; there is no partial
 * match. Implementations must be stateless so one instance can serve
 * concurrent calls.
 */
public interface ChartPatternDetector {

    /**
     * The formation this detector looks for.
     */
    ChartPatternType getPatternType();

    /**
     * Minimum number of bars the detector needs before it will look at all.
     */
    int getMinimumBars(ChartPatternThresholds thresholds);

    /**
     * @param context oldest-first bars with their precomputed extrema
     * @return the match, or empty when the structural preconditions are not met
     */
    Optional<ChartPatternMatch> detect(PatternContext context);
}
