package com.econinsight.analytics.infra.disruptor.event;

import com.econinsight.analytics.domain.model.AnomalyFlag;
import com.econinsight.analytics.domain.model.CorrelationEdge;
import com.econinsight.analytics.domain.model.Forecast;

import java.util.List;

public class AnalyticsResultEvent {

    private ResultType type;
    private String seriesId;
    private Forecast forecast;
    private List<AnomalyFlag> anomalies;
    private List<CorrelationEdge> correlations;
    private long publishNanoTime;

    public void clear() {
        type = null;
        seriesId = null;
        forecast = null;
        anomalies = null;
        correlations = null;
        publishNanoTime = 0L;
    }

    public ResultType getType() {
        return type;
    }

    public void setType(ResultType type) {
        this.type = type;
    }

    public String getSeriesId() {
        return seriesId;
    }

    public void setSeriesId(String seriesId) {
        this.seriesId = seriesId;
    }

    public Forecast getForecast() {
        return forecast;
    }

    public void setForecast(Forecast forecast) {
        this.forecast = forecast;
    }

    public List<AnomalyFlag> getAnomalies() {
        return anomalies;
    }

    public void setAnomalies(List<AnomalyFlag> anomalies) {
        this.anomalies = anomalies;
    }

    public List<CorrelationEdge> getCorrelations() {
        return correlations;
    }

    public void setCorrelations(List<CorrelationEdge> correlations) {
        this.correlations = correlations;
    }

    public long getPublishNanoTime() {
        return publishNanoTime;
    }

    public void setPublishNanoTime(long publishNanoTime) {
        this.publishNanoTime = publishNanoTime;
    }

    @Override
    public String toString() {
        return "AnalyticsResultEvent{type=" + type + ", series=" + seriesId + "}";
    }
}
