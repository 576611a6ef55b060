package org.stockadvisor.analysis.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stockadvisor.analysis.config.AnalysisProperties;
import org.stockadvisor.analysis.model.ChartPatternType;
import org.stockadvisor.analysis.model.InvestmentStyle;
import org.stockadvisor.analysis.model.PriceSeries;
import org.stockadvisor.analysis.model.Signal;
import org.stockadvisor.analysis.model.TechnicalAnalysisReport;
import org.stockadvisor.analysis.patterns.ChartPatternRegistry;
import org.stockadvisor.analysis.safety.SafetyRuleEvaluator;
import org.stockadvisor.analysis.signal.SignalCombiner;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.stockadvisor.analysis.PriceSeriesFixtures.*;

class TechnicalAnalysisServiceTest {

    private TechnicalAnalysisService service;

    @BeforeEach
    void setUp() {
        service = new TechnicalAnalysisService(
            ChartPatternRegistry.withDefaultDetectors(),
            new SafetyRuleEvaluator(),
            new AnalysisProperties()
        );
    }

    @Test
    void testFullReportForDoubleBottom() {
        PriceSeries series = fromCloses(doubleBottom());
        LocalDate latest = series.latest().getDate();

        TechnicalAnalysisReport report = service.analyze(series, latest, InvestmentStyle.BALANCED, true);

        assertEquals(latest, report.getAsOf());
        assertEquals(latest, report.getLatestDate());
        assertFalse(report.isStale());
        assertEquals(30, report.getBarCount());
        assertNotNull(report.getIndicators().getRsi());
        assertNotNull(report.getLatestCandle());
        assertNotNull(report.getCandleSummary());
        assertEquals(ChartPatternType.DOUBLE_BOTTOM, report.getChartPatterns().get(0).getPattern());
        assertNotNull(report.getCombined());
        assertNotNull(report.getTrend());
        assertEquals(Boolean.TRUE, report.getMetrics().getProfitable());
        assertFalse(report.getSafety().isDangerous());
    }

    @Test
    void testBarsAfterAsOfAreIgnored() {
        PriceSeries series = fromCloses(doubleBottom());
        LocalDate asOf = START.plusDays(25);

        TechnicalAnalysisReport report = service.analyze(series, asOf, null, null);

        assertEquals(26, report.getBarCount());
        assertEquals(asOf, report.getLatestDate());
        assertEquals(78, report.getChartPatterns().get(0).getStrength());
    }

    @Test
    void testOldDataIsStale() {
        PriceSeries series = fromCloses(doubleBottom());
        LocalDate asOf = series.latest().getDate().plusDays(8);

        assertTrue(service.analyze(series, asOf, InvestmentStyle.DEFAULT, null).isStale());
        assertFalse(service.analyze(series, asOf.minusDays(1), InvestmentStyle.DEFAULT, null).isStale());
    }

    @Test
    void testNullAsOfUsesLatestBar() {
        PriceSeries series = fromCloses(linear(10, 100, 1));
        TechnicalAnalysisReport report = service.analyze(series, null, InvestmentStyle.DEFAULT, null);

        assertEquals(series.latest().getDate(), report.getAsOf());
        assertFalse(report.isStale());
    }

    @Test
    void testEmptySeriesProducesEmptyReport() {
        TechnicalAnalysisReport report = service.analyze(PriceSeries.empty(), START, InvestmentStyle.DEFAULT, null);

        assertTrue(report.isStale());
        assertNull(report.getLatestDate());
        assertNull(report.getLatestCandle());
        assertTrue(report.getChartPatterns().isEmpty());
        assertEquals(Signal.NEUTRAL, report.getCombined().getSignal());
        assertEquals(SignalCombiner.REASON_INSUFFICIENT_DATA, report.getCombined().getReasons().get(0));
        assertFalse(report.getSafety().anyRaised());
    }

    @Test
    void testLossMakingVolatileStockIsDangerous() {
        double[] closes = new double[30];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = i % 2 == 0 ? 20 : 100;
        }
        TechnicalAnalysisReport report = service.analyze(fromCloses(closes), null, InvestmentStyle.DEFAULT, false);

        assertTrue(report.getMetrics().getVolatility().compareTo(new BigDecimal("50")) > 0);
        assertTrue(report.getSafety().isDangerous());
    }

    @Test
    void testNullSeriesIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.analyze(null, START, null, null));
    }
}
