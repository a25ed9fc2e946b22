package com.econinsight.analytics.domain.exception;

import com.econinsight.analytics.domain.model.ModelTag;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Every sub-model failed for a series. The individual failures are attached as suppressed
 * exceptions and kept per model.
 */
public class EnsembleUnavailableException extends AnalyticsException {

    private final Map<ModelTag, RuntimeException> failures;

    public EnsembleUnavailableException(String seriesId, Map<ModelTag, RuntimeException> failures) {
        super(seriesId, describe(seriesId, failures));
        this.failures = failures.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(failures));
        failures.values().forEach(this::addSuppressed);
    }

    public Map<ModelTag, RuntimeException> getFailures() {
        return failures;
    }

    private static String describe(String seriesId, Map<ModelTag, RuntimeException> failures) {
        if (failures.isEmpty()) {
            return "ensemble unavailable for series " + seriesId + ": no sub-model produced a forecast";
        }
        return "ensemble unavailable for series " + seriesId + ": " + failures.entrySet().stream()
                .map(e -> e.getKey() + " failed (" + e.getValue().getMessage() + ")")
                .collect(Collectors.joining("; "));
    }
}
