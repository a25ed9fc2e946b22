package com.econinsight.analytics.domain.exception;

/**
 * No candidate model could be estimated from an otherwise usable series.
 */
public class ModelEstimationException extends AnalyticsException {

    public ModelEstimationException(String seriesId, String model, int candidates) {
        super(seriesId, String.format(
                "series %s: none of the %d %s candidates could be estimated", seriesId, candidates, model));
    }
}
