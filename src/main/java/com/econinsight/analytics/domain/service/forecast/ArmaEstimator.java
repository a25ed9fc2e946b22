package com.econinsight.analytics.domain.service.forecast;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Conditional-sum-of-squares estimation of ARMA(p, q) on an already differenced series.
 * Parameter vectors outside the stationary/invertible region are rejected with a large penalty.
 */
final class ArmaEstimator {

    static final double INADMISSIBLE = 1e30;
    private static final double UNIT_ROOT_MARGIN = 1e-6;
    private static final double VARIANCE_FLOOR = 1e-12;

    private ArmaEstimator() {
    }

    /**
     * @param start first index whose residual enters the sum of squares; must be at least {@code p}
     */
    static ArmaFit fit(double[] w, int p, int q, boolean includeMean, int start, int maxEvaluations) {
        double mean = includeMean ? StatUtils.mean(w) : 0.0;
        double[] z = new double[w.length];
        for (int i = 0; i < w.length; i++) z[i] = w[i] - mean;

        double[] params = new double[p + q];
        if (p + q > 0) {
            MultivariateFunction objective = candidate -> {
                double[] phi = slice(candidate, 0, p);
                double[] theta = slice(candidate, p, q);
                if (!isStable(phi) || !isStable(negate(theta))) return INADMISSIBLE;
                return sumOfSquares(z, phi, theta, start, null);
            };
            SimplexOptimizer optimizer = new SimplexOptimizer(1e-10, 1e-14);
            PointValuePair optimum = optimizer.optimize(
                    new MaxEval(maxEvaluations),
                    new MaxIter(maxEvaluations),
                    new ObjectiveFunction(objective),
                    GoalType.MINIMIZE,
                    new InitialGuess(new double[p + q]),
                    new NelderMeadSimplex(p + q, 0.2));
            params = optimum.getPoint();
        }

        double[] phi = slice(params, 0, p);
        double[] theta = slice(params, p, q);
        double[] residuals = new double[z.length];
        double css = sumOfSquares(z, phi, theta, start, residuals);
        int effective = z.length - start;
        double sigma2 = Math.max(VARIANCE_FLOOR, css / effective);
        return new ArmaFit(phi, theta, mean, includeMean, sigma2, z, residuals, effective);
    }

    static double sumOfSquares(double[] z, double[] phi, double[] theta, int start, double[] residualsOut) {
        double[] e = residualsOut != null ? residualsOut : new double[z.length];
        double sum = 0.0;
        for (int t = start; t < z.length; t++) {
            double predicted = 0.0;
            for (int i = 1; i <= phi.length; i++) predicted += phi[i - 1] * z[t - i];
            for (int j = 1; j <= theta.length; j++) {
                if (t - j >= start) predicted += theta[j - 1] * e[t - j];
            }
            e[t] = z[t] - predicted;
            sum += e[t] * e[t];
        }
        return sum;
    }

    /**
     * True when the recursion {@code x_t = c_1 x_{t-1} + ... + c_k x_{t-k}} is stable,
     * i.e. every eigenvalue of its companion matrix lies strictly inside the unit circle.
     */
    static boolean isStable(double[] c) {
        int k = c.length;
        if (k == 0) return true;
        if (k == 1) return Math.abs(c[0]) < 1.0 - UNIT_ROOT_MARGIN;
        if (k == 2) {
            double limit = 1.0 - UNIT_ROOT_MARGIN;
            return c[0] + c[1] < limit && c[1] - c[0] < limit && Math.abs(c[1]) < limit;
        }
        double[][] companion = new double[k][k];
        System.arraycopy(c, 0, companion[0], 0, k);
        for (int i = 1; i < k; i++) companion[i][i - 1] = 1.0;
        EigenDecomposition eigen = new EigenDecomposition(new Array2DRowRealMatrix(companion, false));
        double[] re = eigen.getRealEigenvalues();
        double[] im = eigen.getImagEigenvalues();
        for (int i = 0; i < k; i++) {
            if (Math.hypot(re[i], im[i]) >= 1.0 - UNIT_ROOT_MARGIN) return false;
        }
        return true;
    }

    private static double[] slice(double[] source, int from, int length) {
        double[] out = new double[length];
        System.arraycopy(source, from, out, 0, length);
        return out;
    }

    private static double[] negate(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = -values[i];
        return out;
    }

    static final class ArmaFit {

        private final double[] phi;
        private final double[] theta;
        private final double mean;
        private final boolean includeMean;
        private final double sigma2;
        private final double[] centred;
        private final double[] residuals;
        private final int effective;

        ArmaFit(double[] phi, double[] theta, double mean, boolean includeMean, double sigma2,
                double[] centred, double[] residuals, int effective) {
            this.phi = phi;
            this.theta = theta;
            this.mean = mean;
            this.includeMean = includeMean;
            this.sigma2 = sigma2;
            this.centred = centred;
            this.residuals = residuals;
            this.effective = effective;
        }

        double[] phi() {
            return phi.clone();
        }

        double[] theta() {
            return theta.clone();
        }

        double sigma2() {
            return sigma2;
        }

        double mean() {
            return mean;
        }

        int parameterCount() {
            return phi.length + theta.length + (includeMean ? 1 : 0) + 1;
        }

        double logLikelihood() {
            return -0.5 * effective * (Math.log(2.0 * Math.PI * sigma2) + 1.0);
        }

        double aic() {
            return -2.0 * logLikelihood() + 2.0 * parameterCount();
        }

        double bic() {
            return -2.0 * logLikelihood() + parameterCount() * Math.log(effective);
        }

        /** Recursive point forecasts of the differenced series; future shocks are zero. */
        double[] forecast(int steps) {
            int n = centred.length;
            double[] z = new double[n + steps];
            double[] e = new double[n + steps];
            System.arraycopy(centred, 0, z, 0, n);
            System.arraycopy(residuals, 0, e, 0, n);
            double[] out = new double[steps];
            for (int h = 0; h < steps; h++) {
                int t = n + h;
                double value = 0.0;
                for (int i = 1; i <= phi.length; i++) value += phi[i - 1] * z[t - i];
                for (int j = 1; j <= theta.length; j++) value += theta[j - 1] * e[t - j];
                z[t] = value;
                out[h] = value + mean;
            }
            return out;
        }
    }
}
