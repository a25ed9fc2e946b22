package com.econinsight.analytics.domain.service;

import com.econinsight.analytics.domain.model.CategoryRecord;
import com.econinsight.analytics.domain.model.EconomicObservationRecord;
import com.econinsight.analytics.domain.model.Observation;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.repository.CategoryRepository;
import com.econinsight.analytics.domain.repository.EconomicObservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class WarehouseSeriesStore implements SeriesStore {

    private final EconomicObservationRepository observationRepository;
    private final CategoryRepository categoryRepository;

    @Override
    public List<String> seriesIds() {
        return observationRepository.findDistinctSeriesIds();
    }

    @Override
    public Optional<Series> load(String seriesId) {
        List<EconomicObservationRecord> rows = observationRepository.findBySeriesIdOrderByDateKeyAsc(seriesId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        List<Observation> observations = new ArrayList<>(rows.size());
        for (EconomicObservationRecord row : rows) {
            observations.add(new Observation(row.getDateKey(), row.getRawValue()));
        }

        Optional<CategoryRecord> category = categoryRepository.findByFredSeriesId(seriesId);
        Series series = Series.builder()
                .id(seriesId)
                .displayName(category.map(CategoryRecord::getCategoryName).orElse(seriesId))
                .category(category.map(CategoryRecord::getCategoryType).orElse(null))
                .observations(observations)
                .build();

        log.debug("[Store] 시계열 로드: {}", series);
        return Optional.of(series);
    }
}
