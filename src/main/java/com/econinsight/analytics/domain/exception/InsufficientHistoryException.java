package com.econinsight.analytics.domain.exception;

public class InsufficientHistoryException extends AnalyticsException {

    private final int available;
    private final int required;

    public InsufficientHistoryException(String seriesId, int available, int required) {
        this(seriesId, available, required, "observations");
    }

    public InsufficientHistoryException(String seriesId, int available, int required, String what) {
        super(seriesId, String.format("series %s has %d %s, minimum is %d", seriesId, available, what, required));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
