package org.stockadvisor.analysis.patterns;

import org.stockadvisor.analysis.model.ChartPatternMatch;
import org.stockadvisor.analysis.model.PriceSeries;
import org.stockadvisor.analysis.patterns.impl.AscendingTriangleDetector;
import org.stockadvisor.analysis.patterns.impl.BearFlagDetector;
import org.stockadvisor.analysis.patterns.impl.BoxRangeDetector;
import org.stockadvisor.analysis.patterns.impl.BullFlagDetector;
import org.stockadvisor.analysis.patterns.impl.DescendingTriangleDetector;
import org.stockadvisor.analysis.patterns.impl.DoubleBottomDetector;
import org.stockadvisor.analysis.patterns.impl.DoubleTopDetector;
import org.stockadvisor.analysis.patterns.impl.HeadAndShouldersDetector;
import org.stockadvisor.analysis.patterns.impl.InverseHeadAndShouldersDetector;
import org.stockadvisor.analysis.patterns.impl.SymmetricalTriangleDetector;
import org.stockadvisor.analysis.patterns.impl.TripleBottomDetector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered collection of chart pattern detectors.
 *
 * Every detector runs against the same extrema. Matches come back sorted by
 * score (confidence x strength), highest first; ties keep registration order,
 * so the same series always yields the same list. The detector list is
 * fixed at construction; the thresholds bean is read on every call.
 */
public class ChartPatternRegistry {

    private final List<ChartPatternDetector> detectors;
    private final ChartPatternThresholds thresholds;

    public ChartPatternRegistry(List<ChartPatternDetector> detectors, ChartPatternThresholds thresholds) {
        if (detectors == null) {
            throw new IllegalArgumentException("Detectors cannot be null");
        }
        if (thresholds == null) {
            throw new IllegalArgumentException("Thresholds cannot be null");
        }
        this.detectors = List.copyOf(detectors);
        this.thresholds = thresholds;
    }

    /**
     * Registry with every built-in detector: bullish reversals first, then
     * bearish, then neutral formations.
     */
    public static ChartPatternRegistry withDefaultDetectors(ChartPatternThresholds thresholds) {
        return new ChartPatternRegistry(List.of(
            new InverseHeadAndShouldersDetector(),
            new DoubleBottomDetector(),
            new BullFlagDetector(),
            new AscendingTriangleDetector(),
            new TripleBottomDetector(),
            new DoubleTopDetector(),
            new HeadAndShouldersDetector(),
            new BearFlagDetector(),
            new DescendingTriangleDetector(),
            new BoxRangeDetector(),
            new SymmetricalTriangleDetector()
        ), thresholds);
    }

    public static ChartPatternRegistry withDefaultDetectors() {
        return withDefaultDetectors(new ChartPatternThresholds());
    }

    /**
     * Run every detector over the series.
     * @param series oldest-first bars
     * @return matches sorted by score descending; empty below the registry minimum bar count
     */
    public List<ChartPatternMatch> detect(PriceSeries series) {
        if (series == null) {
            throw new IllegalArgumentException("Series cannot be null");
        }
        List<ChartPatternMatch> matches = new ArrayList<>();
        if (series.size() < thresholds.getRegistryMinimumBars()) {
            return matches;
        }

        PatternContext context = PatternContext.of(series, thresholds);
        for (ChartPatternDetector detector : detectors) {
            Optional<ChartPatternMatch> match = detector.detect(context);
            match.ifPresent(matches::add);
        }

        // List.sort is stable
        matches.sort(Comparator.comparing(ChartPatternMatch::getScore).reversed());
        return matches;
    }

    public List<ChartPatternDetector> getDetectors() {
        return detectors;
    }
}
