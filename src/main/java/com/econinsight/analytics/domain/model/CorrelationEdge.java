package com.econinsight.analytics.domain.model;

/**
 * Correlation of an unordered series pair; ids are stored in lexical order.
 * A NaN coefficient means undefined (one side constant over the window).
 */
public record CorrelationEdge(String seriesA, String seriesB, double coefficient, AlignedWindow window) {

    public CorrelationEdge {
        if (seriesA == null || seriesB == null || seriesA.equals(seriesB)) {
            throw new IllegalArgumentException("correlation needs two distinct series: " + seriesA + ", " + seriesB);
        }
        if (seriesA.compareTo(seriesB) > 0) {
            String swap = seriesA;
            seriesA = seriesB;
            seriesB = swap;
        }
        if (!Double.isNaN(coefficient) && (coefficient < -1.0 || coefficient > 1.0)) {
            throw new IllegalArgumentException("coefficient out of range for " + seriesA + "/" + seriesB + ": " + coefficient);
        }
    }

    public boolean isDefined() {
        return !Double.isNaN(coefficient);
    }

    public boolean involves(String seriesId) {
        return seriesA.equals(seriesId) || seriesB.equals(seriesId);
    }

    public String other(String seriesId) {
        return seriesA.equals(seriesId) ? seriesB : seriesA;
    }
}
