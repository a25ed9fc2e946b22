package com.econinsight.analytics.domain.repository;

import com.econinsight.analytics.domain.model.EconomicObservationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface EconomicObservationRepository extends JpaRepository<EconomicObservationRecord, Long> {

    List<EconomicObservationRecord> findBySeriesIdOrderByDateKeyAsc(String seriesId);

    @Query("SELECT DISTINCT e.seriesId FROM EconomicObservationRecord e ORDER BY e.seriesId")
    List<String> findDistinctSeriesIds();
}
