package com.econinsight.analytics.infra.disruptor.monitor;

import com.econinsight.analytics.infra.disruptor.event.AnalyticsResultEvent;
import com.lmax.disruptor.RingBuffer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DisruptorMetricsCollector {

    private final RingBuffer<AnalyticsResultEvent> analyticsResultRingBuffer;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    public void init() {
        Gauge.builder("disruptor.ringbuffer.utilization", analyticsResultRingBuffer, DisruptorMetricsCollector::utilization)
                .tag("pipeline", "output")
                .description("Output RingBuffer utilization (0.0~1.0)")
                .register(meterRegistry);

        Gauge.builder("disruptor.ringbuffer.remaining", analyticsResultRingBuffer,
                        rb -> (double) rb.remainingCapacity())
                .tag("pipeline", "output")
                .description("Output RingBuffer remaining capacity")
                .register(meterRegistry);

        log.info("[Metrics] Disruptor RingBuffer 모니터링 등록 완료");
    }

    @Scheduled(fixedRate = 300_000)
    public void logMetricsSummary() {
        double util = utilization(analyticsResultRingBuffer);
        if (util > 0.0) {
            log.info("[Metrics] Output RB: {}% ({}/{})",
                    String.format("%.1f", util * 100),
                    analyticsResultRingBuffer.getBufferSize() - analyticsResultRingBuffer.remainingCapacity(),
                    analyticsResultRingBuffer.getBufferSize());
        }
    }

    static double utilization(RingBuffer<?> rb) {
        return 1.0 - ((double) rb.remainingCapacity() / rb.getBufferSize());
    }
}
