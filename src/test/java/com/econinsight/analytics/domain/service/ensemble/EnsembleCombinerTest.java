package com.econinsight.analytics.domain.service.ensemble;

import com.econinsight.analytics.domain.exception.EnsembleUnavailableException;
import com.econinsight.analytics.domain.exception.InsufficientHistoryException;
import com.econinsight.analytics.domain.exception.NonStationaryException;
import com.econinsight.analytics.domain.model.EnsembleWeights;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ForecastPoint;
import com.econinsight.analytics.domain.model.ModelTag;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EnsembleCombinerTest {

    private static final LocalDate FIRST = LocalDate.of(2024, 1, 1);

    private final EnsembleCombiner combiner = new EnsembleCombiner();
    private final EnsembleWeights weights = new AnalyticsProperties().getEnsemble().toWeights();

    @Test
    void blendsPointsAndBoundsWithTheWeights() {
        Forecast seasonal = forecast(ModelTag.SEASONAL, new double[]{100, 110}, 2);
        Forecast arima = forecast(ModelTag.AUTOREGRESSIVE, new double[]{90, 100}, 4);

        Forecast blended = combiner.combine("X", List.of(
                SubModelResult.success(seasonal), SubModelResult.success(arima)), weights);

        assertThat(blended.getModelTag()).isEqualTo(ModelTag.ENSEMBLE);
        assertThat(blended.isDegraded()).isFalse();
        assertThat(blended.pointAt(1).pointEstimate()).isCloseTo(96.0, within(1e-9));
        assertThat(blended.pointAt(1).lowerBound()).isCloseTo(0.6 * 98 + 0.4 * 86, within(1e-9));
        assertThat(blended.pointAt(1).upperBound()).isCloseTo(0.6 * 102 + 0.4 * 94, within(1e-9));
        assertThat(blended.getWeights().sum()).isCloseTo(1.0, within(EnsembleWeights.TOLERANCE));
        assertThat(blended.getComponents().get(ModelTag.SEASONAL)).containsExactly(100.0, 110.0);
        assertThat(blended.getComponents().get(ModelTag.AUTOREGRESSIVE)).containsExactly(90.0, 100.0);
    }

    @Test
    void blendingIdenticalForecastsReturnsThem() {
        Forecast a = forecast(ModelTag.SEASONAL, new double[]{5, 6, 7}, 1);
        Forecast b = forecast(ModelTag.AUTOREGRESSIVE, new double[]{5, 6, 7}, 1);

        Forecast blended = combiner.combine("X", List.of(SubModelResult.success(a), SubModelResult.success(b)), weights);

        for (int step = 1; step <= 3; step++) {
            assertThat(blended.pointAt(step).pointEstimate()).isCloseTo(a.pointAt(step).pointEstimate(), within(1e-9));
            assertThat(blended.pointAt(step).lowerBound()).isCloseTo(a.pointAt(step).lowerBound(), within(1e-9));
            assertThat(blended.pointAt(step).upperBound()).isCloseTo(a.pointAt(step).upperBound(), within(1e-9));
        }
    }

    @Test
    void singleSurvivorPassesThroughMarkedDegraded() {
        Forecast seasonal = forecast(ModelTag.SEASONAL, new double[]{100, 101}, 2);
        NonStationaryException failure = new NonStationaryException("X", 2, 1.2);

        Forecast result = combiner.combine("X", List.of(
                SubModelResult.success(seasonal), SubModelResult.failure(ModelTag.AUTOREGRESSIVE, failure)), weights);

        assertThat(result.getModelTag()).isEqualTo(ModelTag.ENSEMBLE);
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getPoints()).isEqualTo(seasonal.getPoints());
        assertThat(result.getContributingModels()).containsExactly(ModelTag.SEASONAL);
        assertThat(result.getWeights().weightOf(ModelTag.SEASONAL)).isEqualTo(1.0);
    }

    @Test
    void noSurvivorsCarriesBothFailures() {
        InsufficientHistoryException seasonalFailure = new InsufficientHistoryException("X", 8, 24);
        InsufficientHistoryException arimaFailure = new InsufficientHistoryException("X", 8, 24);

        assertThatThrownBy(() -> combiner.combine("X", List.of(
                SubModelResult.failure(ModelTag.SEASONAL, seasonalFailure),
                SubModelResult.failure(ModelTag.AUTOREGRESSIVE, arimaFailure)), weights))
                .isInstanceOfSatisfying(EnsembleUnavailableException.class, e -> {
                    assertThat(e.getSeriesId()).isEqualTo("X");
                    assertThat(e.getFailures()).containsEntry(ModelTag.SEASONAL, seasonalFailure)
                            .containsEntry(ModelTag.AUTOREGRESSIVE, arimaFailure);
                    assertThat(e.getSuppressed()).containsExactlyInAnyOrder(seasonalFailure, arimaFailure);
                });
    }

    @Test
    void refusesForecastsOfDifferentHorizons() {
        Forecast a = forecast(ModelTag.SEASONAL, new double[]{1, 2}, 1);
        Forecast b = forecast(ModelTag.AUTOREGRESSIVE, new double[]{1, 2, 3}, 1);

        assertThatThrownBy(() -> combiner.combine("X",
                List.of(SubModelResult.success(a), SubModelResult.success(b)), weights))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("horizons differ");
    }

    static Forecast forecast(ModelTag tag, double[] points, double halfWidth) {
        List<ForecastPoint> list = new ArrayList<>();
        for (int i = 0; i < points.length; i++) {
            list.add(new ForecastPoint(FIRST.plusMonths(i), points[i], points[i] - halfWidth, points[i] + halfWidth));
        }
        return Forecast.builder().seriesId("X").modelTag(tag).horizon(points.length).points(list).build();
    }
}
