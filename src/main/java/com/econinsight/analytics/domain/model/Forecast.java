package com.econinsight.analytics.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.time.YearMonth;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Getter
public class Forecast {

    private final String seriesId;
    private final ModelTag modelTag;
    private final Instant generatedAt;
    private final int horizon;
    private final List<ForecastPoint> points;
    private final boolean degraded;
    private final List<ModelTag> contributingModels;
    private final EnsembleWeights weights;
    private final Map<ModelTag, List<Double>> components;
    private final String modelDescription;

    @Builder(toBuilder = true)
    private Forecast(String seriesId, ModelTag modelTag, Instant generatedAt, int horizon,
                     List<ForecastPoint> points, boolean degraded, List<ModelTag> contributingModels,
                     EnsembleWeights weights, Map<ModelTag, List<Double>> components,
                     String modelDescription) {
        if (seriesId == null || modelTag == null || points == null) {
            throw new IllegalArgumentException("seriesId, modelTag and points are required");
        }
        if (points.size() != horizon) {
            throw new IllegalArgumentException(String.format(
                    "forecast for %s has %d points but horizon %d", seriesId, points.size(), horizon));
        }
        for (int i = 1; i < points.size(); i++) {
            YearMonth expected = YearMonth.from(points.get(0).date()).plusMonths(i);
            if (!YearMonth.from(points.get(i).date()).equals(expected)) {
                throw new IllegalArgumentException(String.format(
                        "forecast for %s is not monthly contiguous at step %d: %s", seriesId, i + 1,
                        points.get(i).date()));
            }
        }
        this.seriesId = seriesId;
        this.modelTag = modelTag;
        this.generatedAt = generatedAt != null ? generatedAt : Instant.now();
        this.horizon = horizon;
        this.points = List.copyOf(points);
        this.degraded = degraded;
        this.contributingModels = contributingModels != null ? List.copyOf(contributingModels) : List.of(modelTag);
        this.weights = weights;
        this.components = components != null && !components.isEmpty()
                ? Map.copyOf(new EnumMap<>(components))
                : Map.of();
        this.modelDescription = modelDescription;
    }

    public ForecastPoint pointAt(int step) {
        return points.get(step - 1);
    }

    public double[] pointEstimates() {
        return points.stream().mapToDouble(ForecastPoint::pointEstimate).toArray();
    }

    public boolean isEnsemble() {
        return modelTag == ModelTag.ENSEMBLE;
    }
}
