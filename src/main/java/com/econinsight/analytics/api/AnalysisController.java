package com.econinsight.analytics.api;

import com.econinsight.analytics.domain.service.AnalysisRunReport;
import com.econinsight.analytics.domain.service.AnalysisRunService;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import com.econinsight.analytics.domain.service.SeriesSummaryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class AnalysisController {

    private final AnalysisRunService analysisRunService;
    private final SeriesSummaryService summaryService;
    private final AnalyticsProperties properties;

    @PostMapping("/run")
    public ResponseEntity<Object> run(@RequestParam(required = false) Integer horizon) {
        int h = horizon != null ? horizon : properties.getDefaultHorizon();
        if (h < 1 || h > properties.getMaxHorizon()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "horizon은 1~" + properties.getMaxHorizon() + " 범위여야 합니다"));
        }
        if (analysisRunService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "success", false,
                    "message", "분석이 이미 실행 중입니다"));
        }

        log.info("[Analysis API] 전체 분석 실행 요청: h={}", h);
        try {
            AnalysisRunReport report = analysisRunService.runAll(h);
            return ResponseEntity.ok(report);
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "success", false,
                    "message", e.getMessage()));
        }
    }

    @GetMapping("/last")
    public ResponseEntity<Object> last() {
        return analysisRunService.lastReport()
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of(
                        "success", false,
                        "message", "아직 실행된 분석이 없습니다")));
    }

    @GetMapping("/summary")
    public ResponseEntity<Object> summary(@RequestParam String seriesId) {
        return summaryService.summarize(seriesId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                        "success", false,
                        "seriesId", seriesId,
                        "message", "존재하지 않는 시계열입니다")));
    }
}
