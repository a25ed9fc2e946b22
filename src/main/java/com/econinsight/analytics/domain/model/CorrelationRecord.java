package com.econinsight.analytics.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "correlation_result", indexes = {
        @Index(name = "idx_corr_pair", columnList = "seriesA, seriesB"),
        @Index(name = "idx_corr_abs", columnList = "absCoefficient")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String seriesA;
    private String seriesB;

    /** Null when the coefficient is undefined. */
    private Double coefficient;
    private Double absCoefficient;

    private int windowSize;
    private LocalDate windowStart;
    private LocalDate windowEnd;
    private long computedEpochMs;
}
