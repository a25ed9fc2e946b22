package com.econinsight.analytics.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Non-negative blending weights per sub-model, always normalised to sum to 1.
 */
public final class EnsembleWeights {

    public static final double TOLERANCE = 1e-6;

    private final Map<ModelTag, Double> weights;

    private EnsembleWeights(Map<ModelTag, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static EnsembleWeights of(Map<ModelTag, Double> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("ensemble weights must not be empty");
        }
        double sum = 0.0;
        for (Map.Entry<ModelTag, Double> entry : raw.entrySet()) {
            ModelTag tag = entry.getKey();
            Double weight = entry.getValue();
            if (tag == null || !tag.isSubModel()) {
                throw new IllegalArgumentException("weights apply to sub-models only, got " + tag);
            }
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                throw new IllegalArgumentException("weight for " + tag + " must be a non-negative number, got " + weight);
            }
            sum += weight;
        }
        if (sum <= 0) {
            throw new IllegalArgumentException("ensemble weights must not all be zero: " + raw);
        }
        Map<ModelTag, Double> normalized = new EnumMap<>(ModelTag.class);
        for (Map.Entry<ModelTag, Double> entry : raw.entrySet()) {
            normalized.put(entry.getKey(), entry.getValue() / sum);
        }
        return new EnsembleWeights(normalized);
    }

    public static EnsembleWeights single(ModelTag tag) {
        Map<ModelTag, Double> map = new EnumMap<>(ModelTag.class);
        map.put(tag, 1.0);
        return of(map);
    }

    public double weightOf(ModelTag tag) {
        return weights.getOrDefault(tag, 0.0);
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    /** Renormalises over the given models; fails if they carry no weight at all. */
    public EnsembleWeights restrictTo(Collection<ModelTag> tags) {
        Map<ModelTag, Double> subset = new EnumMap<>(ModelTag.class);
        for (ModelTag tag : tags) {
            subset.put(tag, weightOf(tag));
        }
        return of(subset);
    }

    @JsonValue
    public Map<ModelTag, Double> asMap() {
        return weights;
    }

    public String version() {
        return weights.entrySet().stream()
                .map(e -> e.getKey().name() + "=" + String.format("%.4f", e.getValue()))
                .collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnsembleWeights other)) return false;
        return weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "EnsembleWeights{" + version() + "}";
    }
}
