package com.econinsight.analytics.infra.warehouse;

import com.econinsight.analytics.domain.model.AnomalyFlag;
import com.econinsight.analytics.domain.model.AnomalyRecord;
import com.econinsight.analytics.domain.model.CorrelationEdge;
import com.econinsight.analytics.domain.model.CorrelationRecord;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ForecastPoint;
import com.econinsight.analytics.domain.model.ForecastRecord;
import com.econinsight.analytics.domain.repository.AnomalyRepository;
import com.econinsight.analytics.domain.repository.CorrelationRepository;
import com.econinsight.analytics.domain.repository.ForecastRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes result sets to the warehouse tables, replacing the previous set for the same key in one transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WarehouseResultWriter {

    private final ForecastRepository forecastRepository;
    private final AnomalyRepository anomalyRepository;
    private final CorrelationRepository correlationRepository;

    @Transactional
    public void replaceForecast(Forecast forecast) {
        long removed = forecastRepository.deleteBySeriesIdAndHorizonAndModelTag(
                forecast.getSeriesId(), forecast.getHorizon(), forecast.getModelTag());

        long generated = forecast.getGeneratedAt().toEpochMilli();
        List<ForecastRecord> rows = new ArrayList<>(forecast.getHorizon());
        for (int step = 1; step <= forecast.getHorizon(); step++) {
            ForecastPoint p = forecast.pointAt(step);
            rows.add(ForecastRecord.builder()
                    .seriesId(forecast.getSeriesId())
                    .horizon(forecast.getHorizon())
                    .step(step)
                    .forecastDate(p.date())
                    .modelTag(forecast.getModelTag())
                    .pointEstimate(p.pointEstimate())
                    .lowerBound(p.lowerBound())
                    .upperBound(p.upperBound())
                    .degraded(forecast.isDegraded())
                    .modelDescription(forecast.getModelDescription())
                    .generatedEpochMs(generated)
                    .build());
        }
        forecastRepository.saveAll(rows);
        log.debug("[Warehouse] 예측 교체: series={}, h={}, removed={}, inserted={}",
                forecast.getSeriesId(), forecast.getHorizon(), removed, rows.size());
    }

    @Transactional
    public void replaceAnomalies(String seriesId, List<AnomalyFlag> flags) {
        long removed = anomalyRepository.deleteBySeriesId(seriesId);
        long now = System.currentTimeMillis();
        List<AnomalyRecord> rows = flags.stream()
                .map(f -> AnomalyRecord.builder()
                        .seriesId(f.seriesId())
                        .observationDate(f.date())
                        .observedValue(f.value())
                        .score(f.score())
                        .outlier(f.outlier())
                        .detectedEpochMs(now)
                        .build())
                .toList();
        anomalyRepository.saveAll(rows);
        log.debug("[Warehouse] 이상치 교체: series={}, removed={}, inserted={}", seriesId, removed, rows.size());
    }

    /** The edge set replaces every stored pair; pairs missing from it are removed. */
    @Transactional
    public void replaceCorrelations(List<CorrelationEdge> edges) {
        long now = System.currentTimeMillis();
        Map<String, CorrelationRecord> existing = new HashMap<>();
        for (CorrelationRecord row : correlationRepository.findAll()) {
            existing.put(pairKey(row.getSeriesA(), row.getSeriesB()), row);
        }

        List<CorrelationRecord> rows = new ArrayList<>(edges.size());
        for (CorrelationEdge edge : edges) {
            CorrelationRecord row = existing.remove(pairKey(edge.seriesA(), edge.seriesB()));
            if (row == null) {
                row = CorrelationRecord.builder()
                        .seriesA(edge.seriesA())
                        .seriesB(edge.seriesB())
                        .build();
            }
            Double coefficient = edge.isDefined() ? edge.coefficient() : null;
            row.setCoefficient(coefficient);
            row.setAbsCoefficient(coefficient != null ? Math.abs(coefficient) : null);
            row.setWindowSize(edge.window().size());
            row.setWindowStart(edge.window().start());
            row.setWindowEnd(edge.window().end());
            row.setComputedEpochMs(now);
            rows.add(row);
        }
        correlationRepository.deleteAll(existing.values());
        correlationRepository.saveAll(rows);
        log.debug("[Warehouse] 상관관계 교체: pairs={}, removed={}", rows.size(), existing.size());
    }

    private static String pairKey(String seriesA, String seriesB) {
        return seriesA + "|" + seriesB;
    }
}
