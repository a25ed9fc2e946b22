package com.econinsight.analytics.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "fact_economic_data",
        uniqueConstraints = @UniqueConstraint(name = "uk_fact_date_category", columnNames = {"dateKey", "categoryKey"}),
        indexes = @Index(name = "idx_fact_series_date", columnList = "seriesId, dateKey"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EconomicObservationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private LocalDate dateKey;
    private String categoryKey;
    private double rawValue;
    private String seriesId;
    private long loadTimestampEpochMs;
}
