package com.econinsight.analytics.domain.repository;

import com.econinsight.analytics.domain.model.ForecastRecord;
import com.econinsight.analytics.domain.model.ModelTag;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ForecastRepository extends JpaRepository<ForecastRecord, Long> {

    List<ForecastRecord> findBySeriesIdAndHorizonAndModelTagOrderByForecastDateAsc(
            String seriesId, int horizon, ModelTag modelTag);

    long deleteBySeriesIdAndHorizonAndModelTag(String seriesId, int horizon, ModelTag modelTag);
}
