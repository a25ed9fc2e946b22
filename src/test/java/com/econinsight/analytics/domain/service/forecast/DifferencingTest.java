package com.econinsight.analytics.domain.service.forecast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DifferencingTest {

    @Test
    void integratingZeroChangesRepeatsTheLastYearAndLevel() {
        double[] history = new double[30];
        for (int i = 0; i < history.length; i++) history[i] = i % 12 + 0.5 * i;
        Differencing differencing = new Differencing(1, 12, 1);
        List<double[]> levels = differencing.levels(history);

        double[] future = differencing.integrate(levels, new double[]{0.0, 0.0, 0.0});

        // with no change in the seasonal difference, each month moves like the same month a year ago
        for (int h = 0; h < 3; h++) {
            int t = history.length + h;
            double expected = history[t - 12] + (history[history.length - 1] - history[history.length - 13]);
            assertThat(future[h]).isCloseTo(expected, within(1e-9));
        }
    }

    @Test
    void secondOrderIntegrationExtendsALine() {
        double[] line = {1, 3, 5, 7, 9, 11};
        Differencing differencing = new Differencing(0, 12, 2);

        double[] future = differencing.integrate(differencing.levels(line), new double[]{0, 0});

        assertThat(future).containsExactly(13.0, 15.0);
    }

    @Test
    void polynomialOfFirstDifferenceSquared() {
        assertThat(new Differencing(0, 12, 2).polynomial()).containsExactly(1.0, -2.0, 1.0);
        assertThat(new Differencing(1, 4, 0).polynomial()).containsExactly(1.0, 0.0, 0.0, 0.0, -1.0);
    }
}
