package com.econinsight.analytics.domain.service.ensemble;

import com.econinsight.analytics.domain.exception.EnsembleUnavailableException;
import com.econinsight.analytics.domain.model.EnsembleWeights;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ForecastPoint;
import com.econinsight.analytics.domain.model.ModelTag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Blends sub-model forecasts into one ENSEMBLE forecast. Points and both bounds are weighted sums of
 * the contributors' values; a lone contributor passes through unchanged and the result is marked degraded.
 */
@Slf4j
@Component
public class EnsembleCombiner {

    public Forecast combine(String seriesId, List<SubModelResult> results, EnsembleWeights weights) {
        List<Forecast> successes = new ArrayList<>();
        Map<ModelTag, RuntimeException> failures = new EnumMap<>(ModelTag.class);
        for (SubModelResult result : results) {
            if (result.succeeded()) {
                successes.add(result.forecast());
            } else {
                failures.put(result.tag(), result.failure());
            }
        }

        if (successes.isEmpty()) {
            throw new EnsembleUnavailableException(seriesId, failures);
        }
        if (successes.size() == 1) {
            Forecast only = successes.get(0);
            log.warn("[Ensemble] 단일 모델로 대체: series={}, model={}, failed={}",
                    seriesId, only.getModelTag(), failures.keySet());
            return degraded(only);
        }
        return blend(seriesId, successes, weights);
    }

    private Forecast degraded(Forecast only) {
        Map<ModelTag, List<Double>> components = new EnumMap<>(ModelTag.class);
        components.put(only.getModelTag(), toList(only.pointEstimates()));
        return Forecast.builder()
                .seriesId(only.getSeriesId())
                .modelTag(ModelTag.ENSEMBLE)
                .generatedAt(Instant.now())
                .horizon(only.getHorizon())
                .points(only.getPoints())
                .degraded(true)
                .contributingModels(List.of(only.getModelTag()))
                .weights(EnsembleWeights.single(only.getModelTag()))
                .components(components)
                .modelDescription(only.getModelDescription())
                .build();
    }

    private Forecast blend(String seriesId, List<Forecast> forecasts, EnsembleWeights weights) {
        Forecast reference = forecasts.get(0);
        List<ModelTag> contributors = new ArrayList<>();
        for (Forecast f : forecasts) {
            if (f.getHorizon() != reference.getHorizon()) {
                throw new IllegalArgumentException(String.format(
                        "cannot blend series %s: horizons differ (%s=%d, %s=%d)", seriesId,
                        reference.getModelTag(), reference.getHorizon(), f.getModelTag(), f.getHorizon()));
            }
            if (!f.pointAt(1).date().equals(reference.pointAt(1).date())) {
                throw new IllegalArgumentException(String.format(
                        "cannot blend series %s: forecasts start on different dates (%s vs %s)", seriesId,
                        reference.pointAt(1).date(), f.pointAt(1).date()));
            }
            contributors.add(f.getModelTag());
        }

        EnsembleWeights effective = weights.restrictTo(contributors);
        List<ForecastPoint> points = new ArrayList<>(reference.getHorizon());
        for (int step = 1; step <= reference.getHorizon(); step++) {
            double point = 0.0;
            double lower = 0.0;
            double upper = 0.0;
            for (Forecast f : forecasts) {
                double w = effective.weightOf(f.getModelTag());
                ForecastPoint p = f.pointAt(step);
                point += w * p.pointEstimate();
                lower += w * p.lowerBound();
                upper += w * p.upperBound();
            }
            // rounding can push a sum a hair past its neighbour
            lower = Math.min(lower, point);
            upper = Math.max(upper, point);
            points.add(new ForecastPoint(reference.pointAt(step).date(), point, lower, upper));
        }

        Map<ModelTag, List<Double>> components = new EnumMap<>(ModelTag.class);
        List<String> descriptions = new ArrayList<>();
        for (Forecast f : forecasts) {
            components.put(f.getModelTag(), toList(f.pointEstimates()));
            if (f.getModelDescription() != null) descriptions.add(f.getModelDescription());
        }

        return Forecast.builder()
                .seriesId(seriesId)
                .modelTag(ModelTag.ENSEMBLE)
                .generatedAt(Instant.now())
                .horizon(reference.getHorizon())
                .points(points)
                .degraded(false)
                .contributingModels(contributors)
                .weights(effective)
                .components(components)
                .modelDescription(String.join(" + ", descriptions))
                .build();
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) list.add(v);
        return list;
    }
}
