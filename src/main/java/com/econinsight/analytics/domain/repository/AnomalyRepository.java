package com.econinsight.analytics.domain.repository;

import com.econinsight.analytics.domain.model.AnomalyRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface AnomalyRepository extends JpaRepository<AnomalyRecord, Long> {

    List<AnomalyRecord> findBySeriesIdAndObservationDateBetweenOrderByObservationDateAsc(
            String seriesId, LocalDate from, LocalDate to);

    long deleteBySeriesId(String seriesId);
}
