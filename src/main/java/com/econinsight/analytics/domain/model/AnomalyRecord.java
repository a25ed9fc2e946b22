package com.econinsight.analytics.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "anomaly_result", indexes = {
        @Index(name = "idx_anomaly_series_date", columnList = "seriesId, observationDate")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String seriesId;
    private LocalDate observationDate;
    private double observedValue;
    private double score;
    private boolean outlier;
    private long detectedEpochMs;
}
