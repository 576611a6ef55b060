package org.stockadvisor.analysis.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stockadvisor.analysis.candlestick.CandlestickClassifier;
import org.stockadvisor.analysis.model.CandlestickPattern;
import org.stockadvisor.analysis.model.ChartPatternType;
import org.stockadvisor.analysis.model.InvestmentStyle;
import org.stockadvisor.analysis.model.PriceBar;
import org.stockadvisor.analysis.model.PriceSeries;
import org.stockadvisor.analysis.model.TechnicalAnalysisReport;
import org.stockadvisor.analysis.patterns.ChartPatternDetector;
import org.stockadvisor.analysis.service.TechnicalAnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API Controller for the technical analysis engine
 *
 * Provides endpoints to:
 * - Analyse a daily price series (indicators, candlesticks, chart patterns, signals, safety flags)
 * - Classify a single candlestick
 * - List the registered chart pattern detectors
 *
 * The controller is stateless: every request carries the full price series.
 */
@RestController
@RequestMapping("/api/analysis")
@CrossOrigin(origins = "*")
@Tag(name = "Analysis", description = "Technical analysis API - indicators, candlestick and chart patterns, combined signals and safety flags")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final TechnicalAnalysisService analysisService;

    public AnalysisController(TechnicalAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    /**
     * Analyse a daily price series
     * POST /api/analysis
     */
    @Operation(
        summary = "Analyse a price series",
        description = "Computes indicators, classifies the latest candles, detects chart patterns and evaluates the safety rules for the given daily bars. Bars dated after asOf are ignored."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Analysis report",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(
                    name = "Report (abridged)",
                    value = """
                    {
                      "asOf": "2024-03-29",
                      "latestDate": "2024-03-29",
                      "stale": false,
                      "barCount": 60,
                      "indicators": { "rsi": 27.45, "sma": 101.20, "macd": { "macd": 0.85, "signal": -0.40, "histogram": 1.25 } },
                      "chartPatterns": [
                        { "pattern": "double_bottom", "signal": "buy", "rank": "S", "strength": 92, "confidence": 0.82 }
                      ],
                      "combined": { "signal": "buy", "strength": 100, "reasons": ["Oversold (RSI)", "Rising momentum (MACD)"] },
                      "safety": { "surge": false, "dangerous": false, "overheated": false, "inDecline": false }
                    }
                    """
                )
            )
        ),
        @ApiResponse(responseCode = "400", description = "Missing or malformed bars")
    })
    @PostMapping
    public ResponseEntity<TechnicalAnalysisReport> analyze(@Valid @RequestBody AnalysisRequest request) {
        List<PriceBar> bars = request.getBars().stream()
            .map(PriceBarDto::toPriceBar)
            .collect(Collectors.toList());
        PriceSeries series = request.getOrder() == SeriesOrder.NEWEST_FIRST
            ? PriceSeries.newestFirst(bars)
            : PriceSeries.oldestFirst(bars);

        log.info("Analysis requested: {} bars, asOf={}, style={}",
            bars.size(), request.getAsOf(), request.getInvestmentStyle());

        return ResponseEntity.ok(analysisService.analyze(
            series, request.getAsOf(), request.getInvestmentStyle(), request.getProfitable()));
    }

    /**
     * Classify one candlestick
     * POST /api/analysis/candlestick
     */
    @Operation(summary = "Classify a candlestick", description = "Classifies a single daily bar by its body and wick proportions.")
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Classification",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(
                    name = "Hammer",
                    value = """
                    {
                      "pattern": "bullish_hammer",
                      "signal": "buy",
                      "strength": 75,
                      "description": "Bottom reversal",
                      "explanation": "The price dipped during the day but buyers pushed it back up. This is a rebound sign."
                    }
                    """
                )
            )
        ),
        @ApiResponse(responseCode = "400", description = "Missing price fields")
    })
    @PostMapping("/candlestick")
    public ResponseEntity<CandlestickPattern> classifyCandlestick(@Valid @RequestBody PriceBarDto bar) {
        return ResponseEntity.ok(CandlestickClassifier.classify(bar.toPriceBar()));
    }

    /**
     * List the registered chart patterns
     * GET /api/analysis/patterns
     */
    @Operation(summary = "List chart patterns", description = "Returns every registered chart pattern detector in registration order.")
    @GetMapping("/patterns")
    public ResponseEntity<List<PatternInfo>> getPatterns() {
        List<PatternInfo> patterns = analysisService.getPatternRegistry().getDetectors().stream()
            .map(ChartPatternDetector::getPatternType)
            .map(PatternInfo::new)
            .collect(Collectors.toList());
        return ResponseEntity.ok(patterns);
    }

    // DTOs

    public enum SeriesOrder {
        OLDEST_FIRST,
        NEWEST_FIRST
    }

    public static class AnalysisRequest {
        @NotNull(message = "Bars cannot be null")
        @Valid
        private List<PriceBarDto> bars;
        private SeriesOrder order = SeriesOrder.OLDEST_FIRST;
        private LocalDate asOf;
        private InvestmentStyle investmentStyle = InvestmentStyle.DEFAULT;
        private Boolean profitable;

        public List<PriceBarDto> getBars() { return bars; }
        public void setBars(List<PriceBarDto> bars) { this.bars = bars; }
        public SeriesOrder getOrder() { return order; }
        public void setOrder(SeriesOrder order) { this.order = order; }
        public LocalDate getAsOf() { return asOf; }
        public void setAsOf(LocalDate asOf) { this.asOf = asOf; }
        public InvestmentStyle getInvestmentStyle() { return investmentStyle; }
        public void setInvestmentStyle(InvestmentStyle investmentStyle) { this.investmentStyle = investmentStyle; }
        public Boolean getProfitable() { return profitable; }
        public void setProfitable(Boolean profitable) { this.profitable = profitable; }
    }

    public static class PriceBarDto {
        @NotNull(message = "Date cannot be null")
        private LocalDate date;
        @NotNull(message = "Open cannot be null")
        private BigDecimal open;
        @NotNull(message = "High cannot be null")
        private BigDecimal high;
        @NotNull(message = "Low cannot be null")
        private BigDecimal low;
        @NotNull(message = "Close cannot be null")
        private BigDecimal close;
        private BigDecimal volume;

        public PriceBar toPriceBar() {
            return new PriceBar(date, open, high, low, close, volume);
        }

        public LocalDate getDate() { return date; }
        public void setDate(LocalDate date) { this.date = date; }
        public BigDecimal getOpen() { return open; }
        public void setOpen(BigDecimal open) { this.open = open; }
        public BigDecimal getHigh() { return high; }
        public void setHigh(BigDecimal high) { this.high = high; }
        public BigDecimal getLow() { return low; }
        public void setLow(BigDecimal low) { this.low = low; }
        public BigDecimal getClose() { return close; }
        public void setClose(BigDecimal close) { this.close = close; }
        public BigDecimal getVolume() { return volume; }
        public void setVolume(BigDecimal volume) { this.volume = volume; }
    }

    public static class PatternInfo {
        private final String id;
        private final String name;
        private final String signal;
        private final String rank;
        private final int referenceWinRate;

        public PatternInfo(ChartPatternType type) {
            this.id = type.getId();
            this.name = type.getDisplayName();
            this.signal = type.getSignal().getValue();
            this.rank = type.getRank().name();
            this.referenceWinRate = type.getReferenceWinRate();
        }

        public String getId() { return id; }
        public String getName() { return name; }
        public String getSignal() { return signal; }
        public String getRank() { return rank; }
        public int getReferenceWinRate() { return referenceWinRate; }
    }
}
