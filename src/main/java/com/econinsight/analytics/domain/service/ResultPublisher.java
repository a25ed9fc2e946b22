package com.econinsight.analytics.domain.service;

import com.econinsight.analytics.domain.model.AnomalyFlag;
import com.econinsight.analytics.domain.model.CorrelationEdge;
import com.econinsight.analytics.domain.model.Forecast;

import java.util.List;

/**
 * Hands finished, immutable results to the warehouse. Each call replaces the previous result set
 * for the same key: (series, horizon, model) for forecasts, series for anomalies, pair for correlations.
 */
public interface ResultPublisher {

    void publishForecast(Forecast forecast);

    void publishAnomalies(String seriesId, List<AnomalyFlag> flags);

    void publishCorrelations(List<CorrelationEdge> edges);
}
