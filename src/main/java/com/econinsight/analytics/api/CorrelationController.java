package com.econinsight.analytics.api;

import com.econinsight.analytics.domain.service.AnalyticsProperties;
import com.econinsight.analytics.domain.service.ResultLookupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/correlations")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class CorrelationController {

    private final ResultLookupService lookupService;
    private final AnalyticsProperties properties;

    @GetMapping
    public ResponseEntity<Object> byPair(@RequestParam String seriesA, @RequestParam String seriesB) {
        if (seriesA.equals(seriesB)) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "서로 다른 두 시계열을 지정해야 합니다"));
        }

        return lookupService.correlation(seriesA, seriesB)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of(
                        "success", false,
                        "message", "해당 쌍의 상관관계가 없습니다 (겹치는 기간 부족 또는 미실행)")));
    }

    @GetMapping("/top")
    public ResponseEntity<Object> top(@RequestParam(required = false) Integer limit) {
        int n = limit != null ? limit : properties.getCorrelation().getTopLimit();
        if (n < 1) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "limit은 1 이상이어야 합니다"));
        }
        return ResponseEntity.ok(lookupService.topCorrelations(n));
    }
}
