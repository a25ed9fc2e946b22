package com.econinsight.analytics.domain.exception;

/**
 * Base of every engine failure. Each instance names the series (or pair) it concerns.
 */
public abstract class AnalyticsException extends RuntimeException {

    private final String seriesId;

    protected AnalyticsException(String seriesId, String message) {
        super(message);
        this.seriesId = seriesId;
    }

    protected AnalyticsException(String seriesId, String message, Throwable cause) {
        super(message, cause);
        this.seriesId = seriesId;
    }

    public String getSeriesId() {
        return seriesId;
    }
}
