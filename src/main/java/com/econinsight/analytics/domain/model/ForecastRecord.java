package com.econinsight.analytics.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "forecast_result", indexes = {
        @Index(name = "idx_forecast_series_horizon", columnList = "seriesId, horizon, modelTag")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String seriesId;
    private int horizon;
    private int step;
    private LocalDate forecastDate;

    @Enumerated(EnumType.STRING)
    private ModelTag modelTag;

    private double pointEstimate;
    private double lowerBound;
    private double upperBound;
    private boolean degraded;
    private String modelDescription;
    private long generatedEpochMs;
}
