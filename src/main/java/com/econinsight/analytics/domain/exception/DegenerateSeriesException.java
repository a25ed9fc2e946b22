package com.econinsight.analytics.domain.exception;

public class DegenerateSeriesException extends AnalyticsException {

    public DegenerateSeriesException(String seriesId, double constantValue) {
        super(seriesId, String.format(
                "series %s is constant at %s over all observations, seasonality is undefined",
                seriesId, constantValue));
    }
}
