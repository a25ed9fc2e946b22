package com.econinsight.analytics.domain.service;

import com.econinsight.analytics.domain.model.AnomalyFlag;
import com.econinsight.analytics.domain.model.CategoryType;
import com.econinsight.analytics.domain.model.ForecastPoint;
import com.econinsight.analytics.domain.model.ModelTag;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything known about one series at a glance. Sections whose analysis has not run yet are null.
 */
@Getter
@Builder
public class SeriesSummary {
    private final String seriesId;
    private final String displayName;
    private final CategoryType category;
    private final Instant analysisDate;

    private final int dataPoints;
    private final LocalDate firstDate;
    private final LocalDate lastDate;
    private final double latestValue;

    private final ForecastSection forecast;
    private final AnomalySection anomalies;
    private final List<RelatedSeries> correlations;

    @Getter
    @Builder
    public static class ForecastSection {
        private final List<ForecastPoint> nextMonths;
        private final Map<ModelTag, List<Double>> components;
        private final boolean degraded;
        private final String modelDescription;
    }

    @Getter
    @Builder
    public static class AnomalySection {
        private final int totalAnomalies;
        /** Percentage of observations flagged. */
        private final double anomalyRate;
        private final List<AnomalyFlag> recentAnomalies;
    }

    @Getter
    @Builder
    public static class RelatedSeries {
        private final String relatedSeries;
        private final double correlation;
        private final int windowSize;
    }
}
