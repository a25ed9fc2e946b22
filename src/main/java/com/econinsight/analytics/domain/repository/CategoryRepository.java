package com.econinsight.analytics.domain.repository;

import com.econinsight.analytics.domain.model.CategoryRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CategoryRepository extends JpaRepository<CategoryRecord, String> {

    Optional<CategoryRecord> findByFredSeriesId(String fredSeriesId);
}
