package com.econinsight.analytics.domain.service.forecast;

import com.econinsight.analytics.domain.exception.DegenerateSeriesException;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ForecastPoint;
import com.econinsight.analytics.domain.model.ModelTag;
import com.econinsight.analytics.domain.model.Observation;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Additive decomposition forecaster: piecewise-linear trend with ridge-penalised changepoints,
 * month-of-year seasonal offsets and optional calendar event boosts, fitted by penalised least squares.
 * The band combines in-sample residual variance with the variance of future trend changes,
 * so it widens with every step.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeasonalForecastModel implements ForecastModel {

    static final int MONTHS_PER_YEAR = 12;
    static final double STRUCTURAL_RIDGE = 1e-6;

    private final AnalyticsProperties properties;
    private final EventCalendar eventCalendar;

    @Override
    public ModelTag tag() {
        return ModelTag.SEASONAL;
    }

    @Override
    public String version() {
        return properties.getSeasonal().getVersion();
    }

    @Override
    public Forecast forecast(Series series, int horizon) {
        ForecastSupport.validateHorizon(horizon, properties.getMaxHorizon());
        ForecastSupport.requireHistory(series, properties.getMinHistory());

        double[] values = series.values();
        if (isConstant(values)) {
            throw new DegenerateSeriesException(series.getId(), values[0]);
        }

        SeasonalFit fit = fit(series, values);
        double z = ForecastSupport.zScore(properties.getSeasonal().getIntervalWidth());

        long lastOffset = fit.span;
        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int h = 1; h <= horizon; h++) {
            LocalDate date = ForecastSupport.stepDate(series, h);
            double point = fit.predict(lastOffset + h, YearMonth.from(date));
            double halfWidth = z * Math.sqrt(fit.variance(h));
            points.add(new ForecastPoint(date, point, point - halfWidth, point + halfWidth));
        }

        log.debug("[Seasonal] 예측 완료: series={}, n={}, changepoints={}, events={}, sigma={}, h={}",
                series.getId(), series.size(), fit.changepoints.length, fit.events.size(),
                String.format("%.4f", Math.sqrt(fit.residualVariance) * fit.scale), horizon);

        return Forecast.builder()
                .seriesId(series.getId())
                .modelTag(ModelTag.SEASONAL)
                .generatedAt(Instant.now())
                .horizon(horizon)
                .points(points)
                .modelDescription(String.format("trend+seasonal(changepoints=%d, events=%d)",
                        fit.changepoints.length, fit.events.size()))
                .build();
    }

    SeasonalFit fit(Series series, double[] values) {
        AnalyticsProperties.Seasonal config = properties.getSeasonal();
        int n = values.length;
        long[] offsets = series.monthOffsets();
        long span = offsets[n - 1];

        double scale = 0.0;
        for (double v : values) scale = Math.max(scale, Math.abs(v));

        double[] tau = new double[n];
        for (int i = 0; i < n; i++) tau[i] = (double) offsets[i] / span;

        double[] changepoints = placeChangepoints(tau, config.getChangepointCount(), config.getChangepointRange());
        List<String> events = activeEvents(series);

        int columns = 2 + changepoints.length + (MONTHS_PER_YEAR - 1) + events.size();
        double[][] design = new double[n + columns - 2][columns];
        double[] target = new double[n + columns - 2];

        for (int i = 0; i < n; i++) {
            Observation o = series.getObservations().get(i);
            design[i] = regressors(tau[i], o.month(), changepoints, events);
            target[i] = values[i] / scale;
        }

        // penalty rows: intercept and base slope stay free
        double changepointRidge = Math.sqrt(config.getChangepointPenalty());
        double structuralRidge = Math.sqrt(STRUCTURAL_RIDGE);
        for (int j = 2; j < columns; j++) {
            int row = n + j - 2;
            design[row][j] = j < 2 + changepoints.length ? changepointRidge : structuralRidge;
        }

        double[] beta = new QRDecomposition(new Array2DRowRealMatrix(design, false))
                .getSolver()
                .solve(new ArrayRealVector(target, false))
                .toArray();

        double sse = 0.0;
        for (int i = 0; i < n; i++) {
            double residual = target[i] - dot(design[i], beta);
            sse += residual * residual;
        }
        int dof = Math.max(1, n - (2 + (MONTHS_PER_YEAR - 1) + events.size()));
        double residualVariance = sse / dof;

        double meanAbsDelta = 0.0;
        for (int j = 0; j < changepoints.length; j++) meanAbsDelta += Math.abs(beta[2 + j]);
        if (changepoints.length > 0) meanAbsDelta /= changepoints.length;

        return new SeasonalFit(beta, changepoints, events, scale, span, residualVariance, meanAbsDelta);
    }

    private double[] regressors(double tau, YearMonth month, double[] changepoints, List<String> events) {
        double[] row = new double[2 + changepoints.length + (MONTHS_PER_YEAR - 1) + events.size()];
        row[0] = 1.0;
        row[1] = tau;
        int col = 2;
        for (double c : changepoints) {
            row[col++] = Math.max(0.0, tau - c);
        }
        int monthOfYear = month.getMonthValue();
        for (int m = 2; m <= MONTHS_PER_YEAR; m++) {
            row[col++] = monthOfYear == m ? 1.0 : 0.0;
        }
        for (String event : events) {
            row[col++] = eventCalendar.occurs(event, month) ? 1.0 : 0.0;
        }
        return row;
    }

    /** Evenly spaced over the first {@code range} share of the observations, first observation excluded. */
    static double[] placeChangepoints(double[] tau, int requested, double range) {
        int historyRows = (int) Math.floor(tau.length * range);
        int count = Math.max(0, Math.min(requested, historyRows - 1));
        double[] changepoints = new double[count];
        for (int j = 1; j <= count; j++) {
            int index = (int) Math.round((double) j * (historyRows - 1) / count);
            changepoints[j - 1] = tau[index];
        }
        return changepoints;
    }

    private List<String> activeEvents(Series series) {
        List<String> active = new ArrayList<>();
        for (String event : eventCalendar.eventNames()) {
            for (Observation o : series.getObservations()) {
                if (eventCalendar.occurs(event, o.month())) {
                    active.add(event);
                    break;
                }
            }
        }
        return active;
    }

    private static boolean isConstant(double[] values) {
        for (double v : values) {
            if (v != values[0]) return false;
        }
        return true;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) sum += a[i] * b[i];
        return sum;
    }

    final class SeasonalFit {

        private final double[] beta;
        private final double[] changepoints;
        private final List<String> events;
        private final double scale;
        private final long span;
        private final double residualVariance;
        private final double meanAbsDelta;

        SeasonalFit(double[] beta, double[] changepoints, List<String> events, double scale, long span,
                    double residualVariance, double meanAbsDelta) {
            this.beta = beta;
            this.changepoints = changepoints;
            this.events = events;
            this.scale = scale;
            this.span = span;
            this.residualVariance = residualVariance;
            this.meanAbsDelta = meanAbsDelta;
        }

        double predict(long monthOffset, YearMonth month) {
            double tau = (double) monthOffset / span;
            return dot(regressors(tau, month, changepoints, events), beta) * scale;
        }

        /**
         * Residual variance plus the variance of the trend drift accumulated by future changepoints
         * (Laplace-distributed slope changes at the historical changepoint rate).
         */
        double variance(int step) {
            double rate = (double) changepoints.length / span;
            double slopeChangeVariance = 2.0 * meanAbsDelta * meanAbsDelta;
            double drift = rate * slopeChangeVariance * step * (step + 1.0) * (2.0 * step + 1.0)
                    / (6.0 * span * span);
            return (residualVariance + drift) * scale * scale;
        }

        double residualSigma() {
            return Math.sqrt(residualVariance) * scale;
        }
    }
}
