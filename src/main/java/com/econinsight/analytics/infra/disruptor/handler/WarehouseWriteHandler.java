package com.econinsight.analytics.infra.disruptor.handler;

import com.econinsight.analytics.infra.disruptor.event.AnalyticsResultEvent;
import com.econinsight.analytics.infra.warehouse.WarehouseResultWriter;
import com.lmax.disruptor.EventHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Writes each result set to the warehouse. A failed write leaves the slot intact for
 * {@link WarehouseWriteExceptionHandler}, which clears it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WarehouseWriteHandler implements EventHandler<AnalyticsResultEvent> {

    private final WarehouseResultWriter writer;
    private final MeterRegistry meterRegistry;

    @Override
    public void onEvent(AnalyticsResultEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) return;

        switch (event.getType()) {
            case FORECAST -> writer.replaceForecast(event.getForecast());
            case ANOMALIES -> writer.replaceAnomalies(event.getSeriesId(), event.getAnomalies());
            case CORRELATIONS -> writer.replaceCorrelations(event.getCorrelations());
        }

        long latencyNanos = System.nanoTime() - event.getPublishNanoTime();
        Timer.builder("analytics.publish.latency")
                .tag("type", event.getType().name())
                .description("Enqueue to warehouse write latency")
                .register(meterRegistry)
                .record(latencyNanos, TimeUnit.NANOSECONDS);

        log.debug("[Warehouse] 기록 완료: type={}, series={}, latency={}μs",
                event.getType(), event.getSeriesId(), latencyNanos / 1_000);
        event.clear();
    }
}
