package com.econinsight.analytics.domain.service;

import com.econinsight.analytics.domain.model.CategoryRecord;
import com.econinsight.analytics.domain.model.CategoryType;
import com.econinsight.analytics.domain.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * The category dimension: twelve FRED indicators grouped into spending, retail and context series.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategoryCatalog {

    static final List<CategoryRecord> DEFAULT_CATEGORIES = List.of(
            category("PCEC96", "Personal Consumption Expenditures", CategoryType.CORE_SPENDING),
            category("DGDSRC1A027NBEA", "Durable Goods Spending", CategoryType.CORE_SPENDING),
            category("NDGSRC1A027NBEA", "Nondurable Goods Spending", CategoryType.CORE_SPENDING),
            category("PCESVC96", "Services Spending", CategoryType.CORE_SPENDING),
            category("RSAFS", "Retail Sales", CategoryType.RETAIL_CHANNEL),
            category("ECOMSA", "E-commerce Sales", CategoryType.RETAIL_CHANNEL),
            category("RSFSDP", "Restaurant Sales", CategoryType.RETAIL_CHANNEL),
            category("MVLOAS", "Motor Vehicle Sales", CategoryType.RETAIL_CHANNEL),
            category("CPIAUCSL", "Consumer Price Index", CategoryType.ECONOMIC_CONTEXT),
            category("UNRATE", "Unemployment Rate", CategoryType.ECONOMIC_CONTEXT),
            category("PAYEMS", "Total Nonfarm Payrolls", CategoryType.ECONOMIC_CONTEXT),
            category("DSPIC96", "Real Disposable Personal Income", CategoryType.ECONOMIC_CONTEXT));

    private final CategoryRepository categoryRepository;

    @Transactional
    @EventListener(ApplicationReadyEvent.class)
    public void seedIfEmpty() {
        if (categoryRepository.count() > 0) {
            return;
        }
        categoryRepository.saveAll(DEFAULT_CATEGORIES.stream().map(CategoryCatalog::copy).toList());
        log.info("[Catalog] 카테고리 차원 초기화: {}개", DEFAULT_CATEGORIES.size());
    }

    public List<CategoryRecord> findAll() {
        return categoryRepository.findAll();
    }

    private static CategoryRecord category(String id, String name, CategoryType type) {
        return CategoryRecord.builder()
                .categoryKey(id)
                .categoryName(name)
                .fredSeriesId(id)
                .categoryType(type)
                .build();
    }

    private static CategoryRecord copy(CategoryRecord source) {
        return category(source.getFredSeriesId(), source.getCategoryName(), source.getCategoryType());
    }
}
