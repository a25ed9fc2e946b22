package com.econinsight.analytics.domain.service;

import com.econinsight.analytics.domain.model.AnomalyFlag;
import com.econinsight.analytics.domain.model.CorrelationEdge;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.anomaly.IsolationForestDetector;
import com.econinsight.analytics.domain.service.correlation.CorrelationAnalyzer;
import com.econinsight.analytics.domain.service.ensemble.EnsembleForecastService;
import com.econinsight.analytics.domain.service.forecast.ForecastSupport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Full analysis pass over every stored series: correlations across the whole set, then anomaly
 * scoring and an ensemble forecast per series. A series that fails to load or analyse is recorded and skipped.
 * The latest results are kept in memory for summaries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisRunService {

    private final SeriesStore seriesStore;
    private final EnsembleForecastService ensembleForecastService;
    private final IsolationForestDetector anomalyDetector;
    private final CorrelationAnalyzer correlationAnalyzer;
    private final ResultPublisher resultPublisher;
    private final AnalyticsProperties properties;
    private final MeterRegistry meterRegistry;

    private final Map<String, Forecast> latestForecasts = new ConcurrentHashMap<>();
    private final Map<String, List<AnomalyFlag>> latestAnomalies = new ConcurrentHashMap<>();
    private volatile List<CorrelationEdge> latestCorrelations = List.of();
    private volatile AnalysisRunReport lastReport;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(cron = "${analytics.schedule.cron:0 0 6 * * *}")
    public void scheduledRun() {
        if (!properties.getSchedule().isEnabled()) {
            return;
        }
        if (running.get()) {
            log.warn("[Analysis] 이전 실행이 진행 중이라 예약 실행을 건너뜀");
            return;
        }
        runAll(properties.getDefaultHorizon());
    }

    public AnalysisRunReport runAll(int horizon) {
        ForecastSupport.validateHorizon(horizon, properties.getMaxHorizon());
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("an analysis run is already in progress");
        }
        try {
            return doRun(horizon);
        } finally {
            running.set(false);
        }
    }

    private AnalysisRunReport doRun(int horizon) {
        Instant startedAt = Instant.now();
        Map<String, String> loadFailures = new TreeMap<>();
        List<Series> all = loadEach(loadFailures);
        log.info("[Analysis] 전체 분석 시작: series={}, h={}", all.size(), horizon);

        List<CorrelationEdge> edges = correlationAnalyzer.analyze(all);
        latestCorrelations = edges;
        resultPublisher.publishCorrelations(edges);

        Map<String, String> anomalyFailures = new ConcurrentHashMap<>();
        all.parallelStream().forEach(series -> {
            try {
                List<AnomalyFlag> flags = anomalyDetector.detect(series);
                latestAnomalies.put(series.getId(), flags);
                resultPublisher.publishAnomalies(series.getId(), flags);
            } catch (RuntimeException e) {
                recordFailure("anomaly", series.getId(), e);
                latestAnomalies.remove(series.getId());
                anomalyFailures.put(series.getId(), e.getMessage());
            }
        });

        List<String> forecasted = new ArrayList<>();
        List<String> degraded = new ArrayList<>();
        Map<String, String> forecastFailures = new TreeMap<>();
        for (Series series : all) {
            try {
                Forecast forecast = ensembleForecastService.forecast(series, horizon);
                latestForecasts.put(series.getId(), forecast);
                resultPublisher.publishForecast(forecast);
                forecasted.add(series.getId());
                if (forecast.isDegraded()) degraded.add(series.getId());
            } catch (RuntimeException e) {
                recordFailure("forecast", series.getId(), e);
                latestForecasts.remove(series.getId());
                forecastFailures.put(series.getId(), e.getMessage());
            }
        }

        AnalysisRunReport report = AnalysisRunReport.builder()
                .startedAt(startedAt)
                .finishedAt(Instant.now())
                .horizon(horizon)
                .seriesCount(all.size())
                .forecasted(List.copyOf(forecasted))
                .degraded(List.copyOf(degraded))
                .anomalySeries(all.size() - anomalyFailures.size())
                .correlationEdges(edges.size())
                .forecastFailures(Collections.unmodifiableMap(forecastFailures))
                .anomalyFailures(Collections.unmodifiableMap(new TreeMap<>(anomalyFailures)))
                .loadFailures(Collections.unmodifiableMap(loadFailures))
                .build();
        lastReport = report;

        log.info("[Analysis] 전체 분석 완료: forecasted={}/{}, degraded={}, 실패(load)={}, 실패(forecast)={}, 실패(anomaly)={}, edges={}",
                forecasted.size(), all.size(), degraded.size(), loadFailures.size(), forecastFailures.size(),
                anomalyFailures.size(), edges.size());
        return report;
    }

    /** Loads series one by one; a series the store cannot build is recorded and left out of the run. */
    private List<Series> loadEach(Map<String, String> loadFailures) {
        List<String> ids = seriesStore.seriesIds();
        List<Series> loaded = new ArrayList<>(ids.size());
        for (String id : ids) {
            try {
                seriesStore.load(id).ifPresent(loaded::add);
            } catch (RuntimeException e) {
                recordFailure("load", id, e);
                loadFailures.put(id, e.getMessage());
            }
        }
        Set<String> loadedIds = loaded.stream().map(Series::getId).collect(Collectors.toSet());
        latestForecasts.keySet().retainAll(loadedIds);
        latestAnomalies.keySet().retainAll(loadedIds);
        return loaded;
    }

    private void recordFailure(String stage, String seriesId, RuntimeException e) {
        Counter.builder("analytics.series.failures")
                .tag("stage", stage)
                .register(meterRegistry)
                .increment();
        log.warn("[Analysis] {} 실패, 건너뜀: series={}, reason={}", stage, seriesId, e.getMessage());
    }

    public Optional<Forecast> latestForecast(String seriesId) {
        return Optional.ofNullable(latestForecasts.get(seriesId));
    }

    public Optional<List<AnomalyFlag>> latestAnomalies(String seriesId) {
        return Optional.ofNullable(latestAnomalies.get(seriesId));
    }

    public List<CorrelationEdge> latestCorrelations() {
        return latestCorrelations;
    }

    public Optional<AnalysisRunReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    public boolean isRunning() {
        return running.get();
    }
}
