package com.econinsight.analytics.domain.exception;

public class NonStationaryException extends AnalyticsException {

    private final int maxDifferencing;

    public NonStationaryException(String seriesId, int maxDifferencing, double lastStatistic) {
        super(seriesId, String.format(
                "series %s is not stationary after %d differencing steps (KPSS statistic %.3f)",
                seriesId, maxDifferencing, lastStatistic));
        this.maxDifferencing = maxDifferencing;
    }

    public int getMaxDifferencing() {
        return maxDifferencing;
    }
}
