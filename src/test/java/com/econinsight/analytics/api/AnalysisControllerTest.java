package com.econinsight.analytics.api;

import com.econinsight.analytics.domain.service.AnalysisRunReport;
import com.econinsight.analytics.domain.service.AnalysisRunService;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import com.econinsight.analytics.domain.service.SeriesSummary;
import com.econinsight.analytics.domain.service.SeriesSummaryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalysisController.class)
@Import(AnalyticsProperties.class)
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnalysisRunService analysisRunService;
    @MockBean
    private SeriesSummaryService summaryService;

    @Test
    void runReturnsTheReport() throws Exception {
        when(analysisRunService.runAll(6)).thenReturn(report());

        mockMvc.perform(post("/api/analysis/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.horizon").value(6))
                .andExpect(jsonPath("$.forecasted[0]").value("PAYEMS"))
                .andExpect(jsonPath("$.forecastFailures.ECOMSA").value("too short"));
    }

    @Test
    void runWhileRunningIsAConflict() throws Exception {
        when(analysisRunService.isRunning()).thenReturn(true);

        mockMvc.perform(post("/api/analysis/run").param("horizon", "3"))
                .andExpect(status().isConflict());
        verify(analysisRunService, never()).runAll(anyInt());
    }

    @Test
    void lostRaceIsAlsoAConflict() throws Exception {
        when(analysisRunService.runAll(4)).thenThrow(new IllegalStateException("an analysis run is already in progress"));

        mockMvc.perform(post("/api/analysis/run").param("horizon", "4"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("an analysis run is already in progress"));
    }

    @Test
    void lastReportBeforeAnyRun() throws Exception {
        when(analysisRunService.lastReport()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/analysis/last"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void summaryOfKnownAndUnknownSeries() throws Exception {
        when(summaryService.summarize("UNRATE")).thenReturn(Optional.of(SeriesSummary.builder()
                .seriesId("UNRATE").displayName("Unemployment Rate").dataPoints(84).build()));
        when(summaryService.summarize("NOPE")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/analysis/summary").param("seriesId", "UNRATE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.displayName").value("Unemployment Rate"))
                .andExpect(jsonPath("$.dataPoints").value(84));
        mockMvc.perform(get("/api/analysis/summary").param("seriesId", "NOPE"))
                .andExpect(status().isNotFound());
    }

    private static AnalysisRunReport report() {
        return AnalysisRunReport.builder()
                .startedAt(Instant.parse("2024-01-01T06:00:00Z"))
                .finishedAt(Instant.parse("2024-01-01T06:00:05Z"))
                .horizon(6)
                .seriesCount(2)
                .forecasted(List.of("PAYEMS"))
                .degraded(List.of())
                .anomalySeries(1)
                .correlationEdges(1)
                .forecastFailures(Map.of("ECOMSA", "too short"))
                .anomalyFailures(Map.of("ECOMSA", "too short"))
                .loadFailures(Map.of())
                .build();
    }
}
