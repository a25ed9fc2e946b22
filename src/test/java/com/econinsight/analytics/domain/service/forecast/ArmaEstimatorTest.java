package com.econinsight.analytics.domain.service.forecast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ArmaEstimatorTest {

    @Test
    void stabilityRegion() {
        assertThat(ArmaEstimator.isStable(new double[]{0.5})).isTrue();
        assertThat(ArmaEstimator.isStable(new double[]{1.0})).isFalse();
        assertThat(ArmaEstimator.isStable(new double[]{0.5, 0.3})).isTrue();
        assertThat(ArmaEstimator.isStable(new double[]{0.8, 0.3})).isFalse();
        assertThat(ArmaEstimator.isStable(new double[]{0.2, 0.1, 0.1})).isTrue();
        assertThat(ArmaEstimator.isStable(new double[]{0.0, 0.0, 1.1})).isFalse();
    }

    @Test
    void recoversAnArOneCoefficient() {
        double[] z = new double[200];
        long state = 12345L;
        for (int t = 1; t < z.length; t++) {
            state = state * 6364136223846793005L + 1442695040888963407L;
            double shock = ((state >>> 11) / (double) (1L << 53)) - 0.5;
            z[t] = 0.7 * z[t - 1] + shock;
        }

        ArmaEstimator.ArmaFit fit = ArmaEstimator.fit(z, 1, 0, false, 1, 4000);

        assertThat(fit.phi()[0]).isCloseTo(0.7, within(0.1));
        assertThat(fit.sigma2()).isGreaterThan(0.0);
        assertThat(fit.aic()).isLessThan(fit.bic());
    }

    @Test
    void forecastOfWhiteNoiseAroundAMeanIsTheMean() {
        double[] w = {4, 6, 4, 6, 4, 6, 4, 6, 4, 6};

        ArmaEstimator.ArmaFit fit = ArmaEstimator.fit(w, 0, 0, true, 0, 100);

        assertThat(fit.mean()).isEqualTo(5.0);
        assertThat(fit.forecast(3)).containsExactly(5.0, 5.0, 5.0);
        assertThat(fit.sigma2()).isCloseTo(1.0, within(1e-12));
    }
}
