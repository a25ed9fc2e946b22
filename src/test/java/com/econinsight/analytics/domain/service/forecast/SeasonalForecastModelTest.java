package com.econinsight.analytics.domain.service.forecast;

import com.econinsight.analytics.domain.exception.DegenerateSeriesException;
import com.econinsight.analytics.domain.exception.InsufficientHistoryException;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ForecastPoint;
import com.econinsight.analytics.domain.model.ModelTag;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import com.econinsight.analytics.support.TestSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SeasonalForecastModelTest {

    private final AnalyticsProperties properties = new AnalyticsProperties();
    private final SeasonalForecastModel model = new SeasonalForecastModel(properties, EventCalendar.empty());

    @Test
    void employmentDeclineCarriesIntoTheForecast() {
        Series series = TestSeries.employment();

        Forecast forecast = model.forecast(series, 3);

        assertThat(forecast.getModelTag()).isEqualTo(ModelTag.SEASONAL);
        assertThat(forecast.pointAt(1).date()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(forecast.pointAt(1).pointEstimate()).isCloseTo(159.29, within(0.3));
        assertThat(forecast.pointAt(2).pointEstimate()).isCloseTo(158.74, within(0.3));
        assertThat(forecast.pointAt(3).pointEstimate()).isCloseTo(158.19, within(0.3));
        assertThat(forecast.pointAt(3).pointEstimate())
                .isLessThan(forecast.pointAt(1).pointEstimate())
                .isLessThan(series.last().value());
    }

    @Test
    void monthEndSeriesForecastsOnMonthEnds() {
        Series series = TestSeries.atMonthEnd(TestSeries.seasonal(36));

        Forecast forecast = model.forecast(series, 3);

        assertThat(forecast.getPoints()).extracting(ForecastPoint::date).containsExactly(
                LocalDate.of(2020, 1, 31), LocalDate.of(2020, 2, 29), LocalDate.of(2020, 3, 31));
        assertThat(forecast.pointAt(2).pointEstimate()).isCloseTo(TestSeries.seasonalValue(37), within(1.0));
    }

    @Test
    void bandWidensWithEveryStep() {
        Forecast forecast = model.forecast(TestSeries.employment(), 12);

        for (int step = 2; step <= 12; step++) {
            assertThat(forecast.pointAt(step).width()).isGreaterThanOrEqualTo(forecast.pointAt(step - 1).width());
        }
        for (ForecastPoint p : forecast.getPoints()) {
            assertThat(p.lowerBound()).isLessThanOrEqualTo(p.pointEstimate());
            assertThat(p.pointEstimate()).isLessThanOrEqualTo(p.upperBound());
        }
    }

    @Test
    void tracksAYearlyCycle() {
        Series series = TestSeries.seasonal(60);

        Forecast forecast = model.forecast(series, 6);

        for (int step = 1; step <= 6; step++) {
            assertThat(forecast.pointAt(step).pointEstimate())
                    .isCloseTo(TestSeries.seasonalValue(59 + step), within(1.0));
        }
    }

    @Test
    void calendarEventBoostsTheMonthsItFallsIn() {
        int[] eventOffsets = {7, 22, 39, 51, 60};
        Series series = TestSeries.generate("RSFSDP", 60, i -> {
            double base = 80.0 + 0.2 * i + 3.0 * Math.sin(2 * Math.PI * i / 12.0);
            for (int e : eventOffsets) if (e == i) return base + 8.0;
            return base;
        });
        Set<YearMonth> months = new TreeSet<>();
        for (int e : eventOffsets) months.add(TestSeries.START.plusMonths(e));
        SeasonalForecastModel withEvents = new SeasonalForecastModel(properties,
                new EventCalendar(Map.of("promotion", months)));

        double boosted = withEvents.forecast(series, 1).pointAt(1).pointEstimate();
        double plain = model.forecast(series, 1).pointAt(1).pointEstimate();

        assertThat(boosted - plain).isGreaterThan(5.0);
        assertThat(boosted).isCloseTo(80.0 + 0.2 * 60 + 8.0, within(1.5));
    }

    @Test
    void shortHistoryNamesSeriesAndMinimum() {
        Series series = TestSeries.generate("PCEC96", 8, i -> i);

        assertThatThrownBy(() -> model.forecast(series, 3))
                .isInstanceOf(InsufficientHistoryException.class)
                .hasMessage("series PCEC96 has 8 observations, minimum is 24");
    }

    @Test
    void constantSeriesIsDegenerate() {
        assertThatThrownBy(() -> model.forecast(TestSeries.constant("FLAT", 36, 4.2), 3))
                .isInstanceOf(DegenerateSeriesException.class)
                .hasMessageContaining("FLAT");
    }

    @Test
    void horizonOutsideOneToTwelveIsRejected() {
        Series series = TestSeries.employment();

        assertThatThrownBy(() -> model.forecast(series, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> model.forecast(series, 13)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void changepointsAreSpreadOverTheEarlyHistory() {
        double[] tau = new double[100];
        for (int i = 0; i < tau.length; i++) tau[i] = i / 99.0;

        double[] changepoints = SeasonalForecastModel.placeChangepoints(tau, 25, 0.9);

        assertThat(changepoints).hasSize(25);
        assertThat(changepoints[0]).isGreaterThan(0.0);
        assertThat(changepoints[24]).isLessThanOrEqualTo(0.9);
        for (int j = 1; j < changepoints.length; j++) {
            assertThat(changepoints[j]).isGreaterThan(changepoints[j - 1]);
        }
    }
}
