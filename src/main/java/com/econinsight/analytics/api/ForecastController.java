package com.econinsight.analytics.api;

import com.econinsight.analytics.domain.exception.AnalyticsException;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ForecastRecord;
import com.econinsight.analytics.domain.model.ModelTag;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import com.econinsight.analytics.domain.service.ResultLookupService;
import com.econinsight.analytics.domain.service.SeriesStore;
import com.econinsight.analytics.domain.service.ensemble.EnsembleForecastService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/forecasts")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ForecastController {

    private final ResultLookupService lookupService;
    private final SeriesStore seriesStore;
    private final EnsembleForecastService ensembleForecastService;
    private final AnalyticsProperties properties;

    @GetMapping
    public ResponseEntity<Object> byHorizon(@RequestParam String seriesId,
                                            @RequestParam(required = false) Integer horizon,
                                            @RequestParam(defaultValue = "ENSEMBLE") ModelTag model) {
        int h = horizon != null ? horizon : properties.getDefaultHorizon();
        if (h < 1 || h > properties.getMaxHorizon()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "horizon은 1~" + properties.getMaxHorizon() + " 범위여야 합니다"));
        }

        List<ForecastRecord> rows = lookupService.forecast(seriesId, h, model);
        if (rows.isEmpty()) {
            return ResponseEntity.ok(Map.of(
                    "success", false,
                    "seriesId", seriesId,
                    "message", "저장된 예측이 없습니다. /api/analysis/run으로 먼저 실행하세요."));
        }
        return ResponseEntity.ok(rows);
    }

    @GetMapping("/live")
    public ResponseEntity<Object> live(@RequestParam String seriesId,
                                       @RequestParam(required = false) Integer horizon) {
        int h = horizon != null ? horizon : properties.getDefaultHorizon();
        if (h < 1 || h > properties.getMaxHorizon()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "horizon은 1~" + properties.getMaxHorizon() + " 범위여야 합니다"));
        }

        Optional<Series> series = seriesStore.load(seriesId);
        if (series.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "success", false,
                    "seriesId", seriesId,
                    "message", "존재하지 않는 시계열입니다"));
        }

        log.info("[Forecast API] 온디맨드 예측 요청: series={}, h={}", seriesId, h);
        try {
            Forecast forecast = ensembleForecastService.forecast(series.get(), h);
            return ResponseEntity.ok(forecast);
        } catch (AnalyticsException e) {
            return ResponseEntity.unprocessableEntity().body(Map.of(
                    "success", false,
                    "seriesId", seriesId,
                    "error", e.getClass().getSimpleName(),
                    "message", e.getMessage()));
        }
    }
}
