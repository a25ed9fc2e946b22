package com.econinsight.analytics.domain.model;

import java.time.LocalDate;
import java.time.YearMonth;

public record Observation(LocalDate date, double value) {

    public Observation {
        if (date == null) {
            throw new IllegalArgumentException("date must not be null");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite: " + date);
        }
    }

    public YearMonth month() {
        return YearMonth.from(date);
    }
}
