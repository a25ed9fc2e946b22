package com.econinsight.analytics.domain.service.forecast;

import com.econinsight.analytics.domain.exception.InsufficientHistoryException;
import com.econinsight.analytics.domain.exception.ModelEstimationException;
import com.econinsight.analytics.domain.exception.NonStationaryException;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ForecastPoint;
import com.econinsight.analytics.domain.model.ModelTag;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Automatic ARIMA forecaster. Differencing orders come from a seasonal-strength check and repeated
 * KPSS tests; the ARMA orders come from a small grid scored by an information criterion.
 * Works on the trailing run of consecutive months so lags always mean "one month back".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutoregressiveForecastModel implements ForecastModel {

    private final AnalyticsProperties properties;

    @Override
    public ModelTag tag() {
        return ModelTag.AUTOREGRESSIVE;
    }

    @Override
    public String version() {
        return properties.getAutoregressive().getVersion();
    }

    @Override
    public Forecast forecast(Series series, int horizon) {
        ForecastSupport.validateHorizon(horizon, properties.getMaxHorizon());
        AnalyticsProperties.Autoregressive config = properties.getAutoregressive();

        Series run = series.trailingContiguousRun();
        if (run.size() < properties.getMinHistory()) {
            throw new InsufficientHistoryException(series.getId(), run.size(), properties.getMinHistory(),
                    series.hasGaps() ? "contiguous observations" : "observations");
        }

        double[] y = run.values();
        int period = config.getSeasonalPeriod();
        int seasonalOrder = seasonalDifferencingOrder(y, config);

        double[] w = seasonalOrder == 1 ? Differencing.diff(y, period) : y;
        int regularOrder = -1;
        double statistic = Double.NaN;
        for (int d = 0; d <= config.getMaxDifferencing(); d++) {
            statistic = StationarityTests.kpss(w);
            if (statistic < StationarityTests.KPSS_CRITICAL_5PCT) {
                regularOrder = d;
                break;
            }
            if (d < config.getMaxDifferencing()) w = Differencing.diff(w, 1);
        }
        if (regularOrder < 0) {
            throw new NonStationaryException(series.getId(), config.getMaxDifferencing(), statistic);
        }

        int start = config.getMaxP();
        int required = start + config.getMaxP() + config.getMaxQ() + 4;
        if (w.length < required) {
            throw new InsufficientHistoryException(series.getId(), w.length, required,
                    "observations after differencing");
        }

        boolean includeMean = regularOrder + seasonalOrder <= 1;
        Candidate best = selectOrder(series.getId(), w, includeMean, start, config);

        Differencing differencing = new Differencing(seasonalOrder, period, regularOrder);
        double[] points = differencing.integrate(differencing.levels(y), best.fit.forecast(horizon));
        double[] psi = psiWeights(best.fit.phi(), best.fit.theta(), differencing, horizon);

        double z = ForecastSupport.zScore(config.getConfidence());
        List<ForecastPoint> forecastPoints = new ArrayList<>(horizon);
        double cumulative = 0.0;
        for (int h = 1; h <= horizon; h++) {
            cumulative += psi[h - 1] * psi[h - 1];
            double halfWidth = z * Math.sqrt(best.fit.sigma2() * cumulative);
            LocalDate date = ForecastSupport.stepDate(run, h);
            double point = points[h - 1];
            forecastPoints.add(new ForecastPoint(date, point, point - halfWidth, point + halfWidth));
        }

        String description = describe(best.p, regularOrder, best.q, seasonalOrder, period, includeMean);
        log.debug("[ARIMA] 모델 선택: series={}, model={}, {}={}, sigma2={}",
                series.getId(), description, config.getCriterion(),
                String.format("%.3f", best.score), String.format("%.5f", best.fit.sigma2()));

        return Forecast.builder()
                .seriesId(series.getId())
                .modelTag(ModelTag.AUTOREGRESSIVE)
                .generatedAt(Instant.now())
                .horizon(horizon)
                .points(forecastPoints)
                .modelDescription(description)
                .build();
    }

    int seasonalDifferencingOrder(double[] y, AnalyticsProperties.Autoregressive config) {
        int period = config.getSeasonalPeriod();
        switch (config.getSeasonalDifferencing()) {
            case NEVER:
                return 0;
            case ALWAYS:
                return y.length > 2 * period ? 1 : 0;
            default:
                if (y.length < 3 * period) return 0;
                double strength = StationarityTests.seasonalStrength(y, period);
                return strength >= config.getSeasonalStrengthThreshold() ? 1 : 0;
        }
    }

    Candidate selectOrder(String seriesId, double[] w, boolean includeMean, int start,
                                  AnalyticsProperties.Autoregressive config) {
        Candidate best = null;
        int effective = w.length - start;
        for (int p = 0; p <= config.getMaxP(); p++) {
            for (int q = 0; q <= config.getMaxQ(); q++) {
                int k = p + q + (includeMean ? 1 : 0) + 1;
                if (effective <= k + 2) continue;
                try {
                    ArmaEstimator.ArmaFit fit = ArmaEstimator.fit(w, p, q, includeMean, start,
                            config.getMaxEvaluations());
                    double score = config.getCriterion() == AnalyticsProperties.InformationCriterion.BIC
                            ? fit.bic() : fit.aic();
                    if (Double.isFinite(score) && (best == null || score < best.score)) {
                        best = new Candidate(p, q, fit, score);
                    }
                } catch (RuntimeException e) {
                    log.debug("[ARIMA] 후보 추정 실패: series={}, p={}, q={}, reason={}",
                            seriesId, p, q, e.getMessage());
                }
            }
        }
        if (best == null) {
            throw new ModelEstimationException(seriesId, "ARMA", (config.getMaxP() + 1) * (config.getMaxQ() + 1));
        }
        return best;
    }

    /** MA(infinity) weights of the full model, AR side expanded with the differencing polynomial. */
    static double[] psiWeights(double[] phi, double[] theta, Differencing differencing, int horizon) {
        double[] arPolynomial = new double[phi.length + 1];
        arPolynomial[0] = 1.0;
        for (int i = 0; i < phi.length; i++) arPolynomial[i + 1] = -phi[i];
        double[] full = Differencing.multiply(arPolynomial, differencing.polynomial());

        double[] psi = new double[horizon];
        psi[0] = 1.0;
        for (int j = 1; j < horizon; j++) {
            double value = j <= theta.length ? theta[j - 1] : 0.0;
            for (int i = 1; i <= Math.min(j, full.length - 1); i++) {
                value += -full[i] * psi[j - i];
            }
            psi[j] = value;
        }
        return psi;
    }

    static String describe(int p, int d, int q, int seasonalOrder, int period, boolean includeMean) {
        String base = String.format("ARIMA(%d,%d,%d)(0,%d,0)[%d]", p, d, q, seasonalOrder, period);
        if (!includeMean) return base;
        return base + (d + seasonalOrder == 0 ? " with mean" : " with drift");
    }

    static final class Candidate {
        private final int p;
        private final int q;
        private final ArmaEstimator.ArmaFit fit;
        private final double score;

        private Candidate(int p, int q, ArmaEstimator.ArmaFit fit, double score) {
            this.p = p;
            this.q = q;
            this.fit = fit;
            this.score = score;
        }
    }
}
