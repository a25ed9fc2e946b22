package com.econinsight.analytics.domain.service;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Getter
@Builder
public class AnalysisRunReport {
    private final Instant startedAt;
    private final Instant finishedAt;
    private final int horizon;
    private final int seriesCount;
    private final List<String> forecasted;
    private final List<String> degraded;
    private final int anomalySeries;
    private final int correlationEdges;
    /** Series id to failure message, per stage. */
    private final Map<String, String> forecastFailures;
    private final Map<String, String> anomalyFailures;
    private final Map<String, String> loadFailures;

    public boolean hasFailures() {
        return !forecastFailures.isEmpty() || !anomalyFailures.isEmpty() || !loadFailures.isEmpty();
    }
}
