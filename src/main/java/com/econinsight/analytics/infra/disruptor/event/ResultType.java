package com.econinsight.analytics.infra.disruptor.event;

public enum ResultType {
    FORECAST,
    ANOMALIES,
    CORRELATIONS
}
