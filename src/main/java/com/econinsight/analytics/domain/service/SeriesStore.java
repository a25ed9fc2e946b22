package com.econinsight.analytics.domain.service;

import com.econinsight.analytics.domain.model.Series;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the monthly indicator series held by the warehouse.
 */
public interface SeriesStore {

    List<String> seriesIds();

    /**
     * @throws IllegalArgumentException when the stored rows do not form a valid series
     */
    Optional<Series> load(String seriesId);
}
