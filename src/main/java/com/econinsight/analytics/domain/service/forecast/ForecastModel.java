package com.econinsight.analytics.domain.service.forecast;

import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ModelTag;
import com.econinsight.analytics.domain.model.Series;

/**
 * Fits a series and projects it forward. Implementations cover the closed set of
 * sub-models named by {@link ModelTag#isSubModel()}; the ensemble only sees this interface.
 */
public interface ForecastModel {

    ModelTag tag();

    /** Changes whenever the fitting procedure changes, so memoised forecasts are not reused across versions. */
    String version();

    /**
     * Fits {@code series} and forecasts {@code horizon} months past its last observation.
     *
     * @throws com.econinsight.analytics.domain.exception.AnalyticsException when the series cannot be fitted
     * @throws IllegalArgumentException when the horizon is outside 1..max-horizon
     */
    Forecast forecast(Series series, int horizon);
}
