package com.econinsight.analytics.domain.repository;

import com.econinsight.analytics.domain.model.CorrelationRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CorrelationRepository extends JpaRepository<CorrelationRecord, Long> {

    Optional<CorrelationRecord> findBySeriesAAndSeriesB(String seriesA, String seriesB);

    List<CorrelationRecord> findByAbsCoefficientNotNullOrderByAbsCoefficientDesc(Pageable pageable);
}
