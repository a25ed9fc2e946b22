package com.econinsight.analytics.domain.service.ensemble;

public record ForecastCacheKey(String seriesId, int horizon, String modelVersion,
                               String weightsVersion, String dataFingerprint) {
}
