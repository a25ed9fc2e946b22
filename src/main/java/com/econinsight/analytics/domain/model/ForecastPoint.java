package com.econinsight.analytics.domain.model;

import java.time.LocalDate;

public record ForecastPoint(LocalDate date, double pointEstimate, double lowerBound, double upperBound) {

    public ForecastPoint {
        if (date == null) {
            throw new IllegalArgumentException("forecast date must not be null");
        }
        if (!Double.isFinite(pointEstimate) || !Double.isFinite(lowerBound) || !Double.isFinite(upperBound)) {
            throw new IllegalArgumentException("forecast values must be finite at " + date);
        }
        if (lowerBound > pointEstimate || pointEstimate > upperBound) {
            throw new IllegalArgumentException(String.format(
                    "bounds out of order at %s: lower=%f, point=%f, upper=%f",
                    date, lowerBound, pointEstimate, upperBound));
        }
    }

    public double width() {
        return upperBound - lowerBound;
    }
}
