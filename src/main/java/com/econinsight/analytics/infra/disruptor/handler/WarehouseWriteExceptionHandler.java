package com.econinsight.analytics.infra.disruptor.handler;

import com.econinsight.analytics.infra.disruptor.event.AnalyticsResultEvent;
import com.econinsight.analytics.infra.disruptor.event.ResultType;
import com.lmax.disruptor.ExceptionHandler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * A failed warehouse write drops that one result set: the failure is counted per result type,
 * logged with its series, and the slot is cleared so the ring keeps moving.
 */
@Slf4j
public class WarehouseWriteExceptionHandler implements ExceptionHandler<AnalyticsResultEvent> {

    static final String FAILURE_METRIC = "analytics.publish.failures";

    private final MeterRegistry meterRegistry;

    public WarehouseWriteExceptionHandler(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, AnalyticsResultEvent event) {
        ResultType type = event != null ? event.getType() : null;
        String seriesId = event != null && event.getSeriesId() != null ? event.getSeriesId() : "-";
        failureCounter(type).increment();
        log.error("[Warehouse] 결과 기록 실패, 해당 결과를 버림: type={}, series={}, seq={}",
                type, seriesId, sequence, ex);
        if (event != null) {
            event.clear();
        }
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("[Warehouse] 기록 핸들러 시작 예외", ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("[Warehouse] 기록 핸들러 종료 예외", ex);
    }

    public double failures(ResultType type) {
        return failureCounter(type).count();
    }

    private Counter failureCounter(ResultType type) {
        return Counter.builder(FAILURE_METRIC)
                .tag("type", type != null ? type.name() : "UNKNOWN")
                .description("Result sets dropped because the warehouse write failed")
                .register(meterRegistry);
    }
}
