package com.econinsight.analytics.api;

import com.econinsight.analytics.domain.model.AnomalyRecord;
import com.econinsight.analytics.domain.service.ResultLookupService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/anomalies")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class AnomalyController {

    private final ResultLookupService lookupService;

    @GetMapping
    public ResponseEntity<Object> byDateRange(
            @RequestParam String seriesId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "false") boolean outliersOnly) {
        if (from.isAfter(to)) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "from은 to보다 이후일 수 없습니다"));
        }

        List<AnomalyRecord> rows = lookupService.anomalies(seriesId, from, to);
        if (outliersOnly) {
            rows = rows.stream().filter(AnomalyRecord::isOutlier).toList();
        }
        return ResponseEntity.ok(rows);
    }
}
