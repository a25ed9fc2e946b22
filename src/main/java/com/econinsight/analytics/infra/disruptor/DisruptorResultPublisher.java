package com.econinsight.analytics.infra.disruptor;

import com.econinsight.analytics.domain.model.AnomalyFlag;
import com.econinsight.analytics.domain.model.CorrelationEdge;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.service.ResultPublisher;
import com.econinsight.analytics.infra.disruptor.event.AnalyticsResultEvent;
import com.econinsight.analytics.infra.disruptor.event.ResultType;
import com.lmax.disruptor.RingBuffer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class DisruptorResultPublisher implements ResultPublisher {

    private final RingBuffer<AnalyticsResultEvent> analyticsResultRingBuffer;
    private final MeterRegistry meterRegistry;

    @Override
    public void publishForecast(Forecast forecast) {
        analyticsResultRingBuffer.publishEvent((event, seq) -> {
            event.setType(ResultType.FORECAST);
            event.setSeriesId(forecast.getSeriesId());
            event.setForecast(forecast);
            event.setPublishNanoTime(System.nanoTime());
        });
        published(ResultType.FORECAST);
    }

    @Override
    public void publishAnomalies(String seriesId, List<AnomalyFlag> flags) {
        List<AnomalyFlag> snapshot = List.copyOf(flags);
        analyticsResultRingBuffer.publishEvent((event, seq) -> {
            event.setType(ResultType.ANOMALIES);
            event.setSeriesId(seriesId);
            event.setAnomalies(snapshot);
            event.setPublishNanoTime(System.nanoTime());
        });
        published(ResultType.ANOMALIES);
    }

    @Override
    public void publishCorrelations(List<CorrelationEdge> edges) {
        List<CorrelationEdge> snapshot = List.copyOf(edges);
        analyticsResultRingBuffer.publishEvent((event, seq) -> {
            event.setType(ResultType.CORRELATIONS);
            event.setCorrelations(snapshot);
            event.setPublishNanoTime(System.nanoTime());
        });
        published(ResultType.CORRELATIONS);
    }

    private void published(ResultType type) {
        Counter.builder("analytics.results.published")
                .tag("type", type.name())
                .register(meterRegistry)
                .increment();
    }
}
