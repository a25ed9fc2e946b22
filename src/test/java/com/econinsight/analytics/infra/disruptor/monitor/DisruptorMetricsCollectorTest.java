package com.econinsight.analytics.infra.disruptor.monitor;

import com.econinsight.analytics.infra.disruptor.event.AnalyticsResultEvent;
import com.econinsight.analytics.infra.disruptor.event.AnalyticsResultEventFactory;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.Sequence;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DisruptorMetricsCollectorTest {

    @Test
    void gaugesFollowTheBacklog() {
        RingBuffer<AnalyticsResultEvent> ringBuffer =
                RingBuffer.createMultiProducer(new AnalyticsResultEventFactory(), 8);
        // a consumer that never advances, so published slots stay occupied
        ringBuffer.addGatingSequences(new Sequence());
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        new DisruptorMetricsCollector(ringBuffer, meterRegistry).init();

        for (int i = 0; i < 2; i++) {
            ringBuffer.publishEvent((event, seq) -> event.setSeriesId("PAYEMS"));
        }

        assertThat(DisruptorMetricsCollector.utilization(ringBuffer)).isEqualTo(0.25);
        assertThat(meterRegistry.get("disruptor.ringbuffer.remaining").gauge().value()).isEqualTo(6.0);
        assertThat(meterRegistry.get("disruptor.ringbuffer.utilization").gauge().value()).isEqualTo(0.25);
    }
}
