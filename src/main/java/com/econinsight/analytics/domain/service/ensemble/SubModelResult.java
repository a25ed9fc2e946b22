package com.econinsight.analytics.domain.service.ensemble;

import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ModelTag;

/**
 * Outcome of one sub-model task: either a forecast or the exception that stopped it.
 */
public final class SubModelResult {

    private final ModelTag tag;
    private final Forecast forecast;
    private final RuntimeException failure;

    private SubModelResult(ModelTag tag, Forecast forecast, RuntimeException failure) {
        this.tag = tag;
        this.forecast = forecast;
        this.failure = failure;
    }

    public static SubModelResult success(Forecast forecast) {
        return new SubModelResult(forecast.getModelTag(), forecast, null);
    }

    public static SubModelResult failure(ModelTag tag, RuntimeException failure) {
        return new SubModelResult(tag, null, failure);
    }

    public ModelTag tag() {
        return tag;
    }

    public boolean succeeded() {
        return forecast != null;
    }

    public Forecast forecast() {
        return forecast;
    }

    public RuntimeException failure() {
        return failure;
    }

    @Override
    public String toString() {
        return succeeded() ? "SubModelResult{" + tag + " ok}"
                : "SubModelResult{" + tag + " failed: " + failure.getMessage() + "}";
    }
}
