package org.stockadvisor.analysis.controller;

import org.junit.jupiter.api.Test;
import org.stockadvisor.analysis.config.AnalysisConfig;
import org.stockadvisor.analysis.service.TechnicalAnalysisService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.stockadvisor.analysis.PriceSeriesFixtures.*;

@WebMvcTest(AnalysisController.class)
@Import({AnalysisConfig.class, TechnicalAnalysisService.class})
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testAnalyzeDoubleBottom() throws Exception {
        String body = "{\"bars\":" + barsJson(doubleBottom(), false) +
            ",\"investmentStyle\":\"balanced\",\"profitable\":true}";

        mockMvc.perform(post("/api/analysis").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.barCount").value(30))
            .andExpect(jsonPath("$.latestDate").value("2024-01-30"))
            .andExpect(jsonPath("$.stale").value(false))
            .andExpect(jsonPath("$.chartPatterns[0].pattern").value("double_bottom"))
            .andExpect(jsonPath("$.chartPatterns[0].signal").value("buy"))
            .andExpect(jsonPath("$.chartPatterns[0].rank").value("S"))
            .andExpect(jsonPath("$.safety.dangerous").value(false));
    }

    @Test
    void testNewestFirstOrderIsReversed() throws Exception {
        String body = "{\"order\":\"NEWEST_FIRST\",\"bars\":" + barsJson(doubleBottom(), true) + "}";

        mockMvc.perform(post("/api/analysis").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.latestDate").value("2024-01-30"))
            .andExpect(jsonPath("$.chartPatterns[0].pattern").value("double_bottom"));
    }

    @Test
    void testMissingBarsIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analysis").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation failed"))
            .andExpect(jsonPath("$.errors[0]").value("Bars cannot be null"));
    }

    @Test
    void testBarWithoutCloseIsBadRequest() throws Exception {
        String body = "{\"bars\":[{\"date\":\"2024-01-01\",\"open\":1,\"high\":2,\"low\":0.5}]}";

        mockMvc.perform(post("/api/analysis").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testMalformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analysis").contentType(MediaType.APPLICATION_JSON).content("{\"bars\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void testClassifyCandlestick() throws Exception {
        String body = "{\"date\":\"2024-01-02\",\"open\":100,\"high\":101,\"low\":95,\"close\":100.8}";

        mockMvc.perform(post("/api/analysis/candlestick").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pattern").value("bullish_hammer"))
            .andExpect(jsonPath("$.signal").value("buy"))
            .andExpect(jsonPath("$.strength").value(75));
    }

    @Test
    void testListPatterns() throws Exception {
        mockMvc.perform(get("/api/analysis/patterns"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(11)))
            .andExpect(jsonPath("$[0].id").value("inverse_head_and_shoulders"))
            .andExpect(jsonPath("$[0].rank").value("S"))
            .andExpect(jsonPath("$[0].referenceWinRate").value(89));
    }

    // ==================== Helper Methods ====================

    private String barsJson(double[] closes, boolean newestFirst) {
        StringBuilder json = new StringBuilder("[");
        for (int k = 0; k < closes.length; k++) {
            int i = newestFirst ? closes.length - 1 - k : k;
            LocalDate date = START.plusDays(i);
            double c = closes[i];
            if (k > 0) {
                json.append(',');
            }
            json.append("{\"date\":\"").append(date)
                .append("\",\"open\":").append(c)
                .append(",\"high\":").append(c + 0.5)
                .append(",\"low\":").append(c - 0.5)
                .append(",\"close\":").append(c)
                .append('}');
        }
        return json.append(']').toString();
    }
}
