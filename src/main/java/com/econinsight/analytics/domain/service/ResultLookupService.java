package com.econinsight.analytics.domain.service;

import com.econinsight.analytics.domain.model.AnomalyRecord;
import com.econinsight.analytics.domain.model.CorrelationRecord;
import com.econinsight.analytics.domain.model.ForecastRecord;
import com.econinsight.analytics.domain.model.ModelTag;
import com.econinsight.analytics.domain.repository.AnomalyRepository;
import com.econinsight.analytics.domain.repository.CorrelationRepository;
import com.econinsight.analytics.domain.repository.ForecastRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only lookups over published results, as needed by the query layer.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ResultLookupService {

    private final ForecastRepository forecastRepository;
    private final AnomalyRepository anomalyRepository;
    private final CorrelationRepository correlationRepository;

    public List<ForecastRecord> forecast(String seriesId, int horizon, ModelTag modelTag) {
        return forecastRepository.findBySeriesIdAndHorizonAndModelTagOrderByForecastDateAsc(seriesId, horizon, modelTag);
    }

    public List<AnomalyRecord> anomalies(String seriesId, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("date range is inverted: " + from + " > " + to);
        }
        return anomalyRepository.findBySeriesIdAndObservationDateBetweenOrderByObservationDateAsc(seriesId, from, to);
    }

    /** Pair order does not matter. */
    public Optional<CorrelationRecord> correlation(String seriesA, String seriesB) {
        if (seriesA.equals(seriesB)) {
            throw new IllegalArgumentException("correlation needs two distinct series, got " + seriesA + " twice");
        }
        boolean ordered = seriesA.compareTo(seriesB) < 0;
        return correlationRepository.findBySeriesAAndSeriesB(ordered ? seriesA : seriesB, ordered ? seriesB : seriesA);
    }

    public List<CorrelationRecord> topCorrelations(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        return correlationRepository.findByAbsCoefficientNotNullOrderByAbsCoefficientDesc(PageRequest.of(0, limit));
    }
}
