package com.econinsight.analytics.domain.service.forecast;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered list of differencing operations (lag 12 for seasonal, lag 1 for regular) that can be
 * applied to a history and inverted on forecasts of the differenced series.
 */
final class Differencing {

    private final List<Integer> lags;

    Differencing(int seasonalOrder, int seasonalPeriod, int regularOrder) {
        List<Integer> ops = new ArrayList<>();
        for (int i = 0; i < seasonalOrder; i++) ops.add(seasonalPeriod);
        for (int i = 0; i < regularOrder; i++) ops.add(1);
        this.lags = List.copyOf(ops);
    }

    static double[] diff(double[] x, int lag) {
        if (lag >= x.length) return new double[0];
        double[] out = new double[x.length - lag];
        for (int i = lag; i < x.length; i++) {
            out[i - lag] = x[i] - x[i - lag];
        }
        return out;
    }

    /** Every intermediate level, from the raw history (index 0) to the fully differenced series. */
    List<double[]> levels(double[] history) {
        List<double[]> levels = new ArrayList<>(lags.size() + 1);
        levels.add(history);
        double[] current = history;
        for (int lag : lags) {
            current = diff(current, lag);
            levels.add(current);
        }
        return levels;
    }

    /** Turns forecasts of the differenced series back into forecasts of the raw series. */
    double[] integrate(List<double[]> levels, double[] differencedForecast) {
        double[] future = differencedForecast;
        for (int k = lags.size() - 1; k >= 0; k--) {
            int lag = lags.get(k);
            double[] history = levels.get(k);
            int n = history.length;
            double[] undone = new double[future.length];
            for (int h = 0; h < future.length; h++) {
                int source = n + h - lag;
                double base = source < n ? history[source] : undone[source - n];
                undone[h] = future[h] + base;
            }
            future = undone;
        }
        return future;
    }

    /** Coefficients of (1 - B)^d (1 - B^s)^D, lowest power first. */
    double[] polynomial() {
        double[] poly = {1.0};
        for (int lag : lags) {
            double[] factor = new double[lag + 1];
            factor[0] = 1.0;
            factor[lag] = -1.0;
            poly = multiply(poly, factor);
        }
        return poly;
    }

    int totalOrder() {
        return lags.size();
    }

    static double[] multiply(double[] a, double[] b) {
        double[] out = new double[a.length + b.length - 1];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < b.length; j++) {
                out[i + j] += a[i] * b[j];
            }
        }
        return out;
    }
}
