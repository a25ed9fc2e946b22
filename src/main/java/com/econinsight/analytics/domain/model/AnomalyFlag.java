package com.econinsight.analytics.domain.model;

import java.time.LocalDate;

public record AnomalyFlag(String seriesId, LocalDate date, double value, double score, boolean outlier) {
}
