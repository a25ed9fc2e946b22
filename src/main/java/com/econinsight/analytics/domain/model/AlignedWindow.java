package com.econinsight.analytics.domain.model;

import java.time.LocalDate;

/** Shared months of a correlation pair. */
public record AlignedWindow(int size, LocalDate start, LocalDate end) {
}
