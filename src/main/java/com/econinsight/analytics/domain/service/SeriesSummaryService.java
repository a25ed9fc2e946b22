package com.econinsight.analytics.domain.service;

import com.econinsight.analytics.domain.model.AnomalyFlag;
import com.econinsight.analytics.domain.model.CorrelationEdge;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ModelTag;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.correlation.CorrelationAnalyzer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class SeriesSummaryService {

    static final int SUMMARY_MONTHS = 3;
    static final int RECENT_ANOMALIES = 5;
    static final int RELATED_SERIES = 3;

    private final SeriesStore seriesStore;
    private final AnalysisRunService analysisRunService;

    public Optional<SeriesSummary> summarize(String seriesId) {
        return seriesStore.load(seriesId).map(this::summarize);
    }

    SeriesSummary summarize(Series series) {
        String id = series.getId();
        SeriesSummary.SeriesSummaryBuilder builder = SeriesSummary.builder()
                .seriesId(id)
                .displayName(series.getDisplayName())
                .category(series.getCategory())
                .analysisDate(Instant.now())
                .dataPoints(series.size());

        if (!series.isEmpty()) {
            builder.firstDate(series.first().date())
                    .lastDate(series.last().date())
                    .latestValue(series.last().value());
        }

        analysisRunService.latestForecast(id)
                .map(SeriesSummaryService::forecastSection)
                .ifPresent(builder::forecast);

        analysisRunService.latestAnomalies(id)
                .map(SeriesSummaryService::anomalySection)
                .ifPresent(builder::anomalies);

        List<CorrelationEdge> edges = analysisRunService.latestCorrelations();
        if (!edges.isEmpty()) {
            builder.correlations(CorrelationAnalyzer.strongestFor(id, edges, RELATED_SERIES).stream()
                    .map(e -> SeriesSummary.RelatedSeries.builder()
                            .relatedSeries(e.other(id))
                            .correlation(e.coefficient())
                            .windowSize(e.window().size())
                            .build())
                    .toList());
        }
        return builder.build();
    }

    private static SeriesSummary.ForecastSection forecastSection(Forecast forecast) {
        int months = Math.min(SUMMARY_MONTHS, forecast.getHorizon());
        Map<ModelTag, List<Double>> components = new EnumMap<>(ModelTag.class);
        forecast.getComponents().forEach((tag, points) -> components.put(tag, points.subList(0, months)));
        return SeriesSummary.ForecastSection.builder()
                .nextMonths(forecast.getPoints().subList(0, months))
                .components(components)
                .degraded(forecast.isDegraded())
                .modelDescription(forecast.getModelDescription())
                .build();
    }

    private static SeriesSummary.AnomalySection anomalySection(List<AnomalyFlag> flags) {
        List<AnomalyFlag> outliers = flags.stream().filter(AnomalyFlag::outlier).toList();
        List<AnomalyFlag> recent = outliers.subList(Math.max(0, outliers.size() - RECENT_ANOMALIES), outliers.size());
        return SeriesSummary.AnomalySection.builder()
                .totalAnomalies(outliers.size())
                .anomalyRate(flags.isEmpty() ? 0.0 : 100.0 * outliers.size() / flags.size())
                .recentAnomalies(recent)
                .build();
    }
}
