package com.econinsight.analytics.domain.service.forecast;

import com.econinsight.analytics.domain.exception.AnalyticsException;
import com.econinsight.analytics.domain.exception.InsufficientHistoryException;
import com.econinsight.analytics.domain.exception.ModelEstimationException;
import com.econinsight.analytics.domain.exception.NonStationaryException;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ForecastPoint;
import com.econinsight.analytics.domain.model.ModelTag;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import com.econinsight.analytics.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AutoregressiveForecastModelTest {

    private final AnalyticsProperties properties = new AnalyticsProperties();
    private final AutoregressiveForecastModel model = new AutoregressiveForecastModel(properties);

    @Test
    void stationarySeriesNeedsNoDifferencing() {
        Forecast forecast = model.forecast(TestSeries.stationary(48), 6);

        assertThat(forecast.getModelTag()).isEqualTo(ModelTag.AUTOREGRESSIVE);
        assertThat(forecast.getModelDescription()).matches("ARIMA\\(\\d,0,\\d\\)\\(0,0,0\\)\\[12\\] with mean");
        for (ForecastPoint p : forecast.getPoints()) {
            assertThat(p.pointEstimate()).isBetween(44.0, 56.0);
        }
    }

    @Test
    void monthEndSeriesForecastsOnMonthEnds() {
        Series series = TestSeries.atMonthEnd(TestSeries.stationary(48));

        Forecast forecast = model.forecast(series, 3);

        assertThat(forecast.getPoints()).extracting(ForecastPoint::date).containsExactly(
                LocalDate.of(2021, 1, 31), LocalDate.of(2021, 2, 28), LocalDate.of(2021, 3, 31));
    }

    @Test
    void noEstimableCandidateIsAnAnalyticsFailure() {
        properties.getAutoregressive().setMaxEvaluations(200);
        double[] w = IntStream.range(0, 30).mapToDouble(i -> i == 10 ? Double.NaN : Math.sin(i)).toArray();

        assertThatThrownBy(() -> model.selectOrder("ECOMSA", w, true, 2, properties.getAutoregressive()))
                .isInstanceOf(ModelEstimationException.class)
                .isInstanceOf(AnalyticsException.class)
                .hasMessage("series ECOMSA: none of the 9 ARMA candidates could be estimated");
    }

    @Test
    void strongYearlyCycleIsSeasonallyDifferenced() {
        Series series = TestSeries.seasonal(60);

        Forecast forecast = model.forecast(series, 6);

        assertThat(forecast.getModelDescription()).contains(",0,", "(0,1,0)[12]", "with drift");
        for (int step = 1; step <= 6; step++) {
            assertThat(forecast.pointAt(step).pointEstimate())
                    .isCloseTo(TestSeries.seasonalValue(59 + step), within(0.3));
        }
    }

    @Test
    void employmentTurnIsDifferencedTwiceAndKeepsFalling() {
        Series series = TestSeries.employment();

        Forecast forecast = model.forecast(series, 6);

        assertThat(forecast.getModelDescription()).matches("ARIMA\\(\\d,2,\\d\\)\\(0,0,0\\)\\[12\\]");
        assertThat(forecast.pointAt(3).pointEstimate()).isBetween(156.0, 159.6);
        assertThat(forecast.pointAt(6).pointEstimate()).isLessThan(forecast.pointAt(1).pointEstimate());
    }

    @Test
    void intervalsAreOrderedAndWiden() {
        Forecast forecast = model.forecast(TestSeries.employment(), 12);

        for (int step = 1; step <= 12; step++) {
            ForecastPoint p = forecast.pointAt(step);
            assertThat(p.lowerBound()).isLessThanOrEqualTo(p.pointEstimate());
            assertThat(p.upperBound()).isGreaterThanOrEqualTo(p.pointEstimate());
            if (step > 1) {
                assertThat(p.width()).isGreaterThanOrEqualTo(forecast.pointAt(step - 1).width());
            }
        }
    }

    @Test
    void explosiveGrowthIsNotStationaryAfterTwoDifferences() {
        Series series = TestSeries.generate("CPIAUCSL", 36, t -> Math.exp(0.15 * t));

        assertThatThrownBy(() -> model.forecast(series, 3))
                .isInstanceOf(NonStationaryException.class)
                .hasMessageContaining("CPIAUCSL")
                .hasMessageContaining("2 differencing steps");
    }

    @Test
    void usesOnlyTheTrailingContiguousRun() {
        int[] offsets = IntStream.concat(IntStream.range(0, 30), IntStream.range(33, 53)).toArray();
        Series series = TestSeries.atOffsets("ECOMSA", offsets, i -> 10.0 + Math.sin(i));

        assertThatThrownBy(() -> model.forecast(series, 3))
                .isInstanceOf(InsufficientHistoryException.class)
                .hasMessage("series ECOMSA has 20 contiguous observations, minimum is 24");
    }

    @Test
    void neverModeSkipsSeasonalDifferencing() {
        properties.getAutoregressive().setSeasonalDifferencing(AnalyticsProperties.SeasonalDifferencing.NEVER);

        Forecast forecast = model.forecast(TestSeries.seasonal(60), 3);

        assertThat(forecast.getModelDescription()).contains("(0,0,0)[12]");
    }

    @Test
    void psiWeightsOfARandomWalkAreAllOne() {
        Differencing once = new Differencing(0, 12, 1);

        double[] psi = AutoregressiveForecastModel.psiWeights(new double[0], new double[0], once, 5);

        assertThat(psi).containsExactly(1.0, 1.0, 1.0, 1.0, 1.0);
    }

    @Test
    void psiWeightsOfAnArOneDecayGeometrically() {
        double[] psi = AutoregressiveForecastModel.psiWeights(new double[]{0.5}, new double[0],
                new Differencing(0, 12, 0), 4);

        assertThat(psi[0]).isEqualTo(1.0);
        assertThat(psi[1]).isCloseTo(0.5, within(1e-12));
        assertThat(psi[2]).isCloseTo(0.25, within(1e-12));
        assertThat(psi[3]).isCloseTo(0.125, within(1e-12));
    }
}
