package com.econinsight.analytics.infra.disruptor.config;

import com.econinsight.analytics.infra.disruptor.event.AnalyticsResultEvent;
import com.econinsight.analytics.infra.disruptor.event.AnalyticsResultEventFactory;
import com.econinsight.analytics.infra.disruptor.handler.WarehouseWriteExceptionHandler;
import com.econinsight.analytics.infra.disruptor.handler.WarehouseWriteHandler;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class OutputDisruptorConfig {

    private static final int OUTPUT_BUFFER_SIZE = 1024;

    private final WarehouseWriteHandler warehouseWriteHandler;
    private final MeterRegistry meterRegistry;
    private final Environment environment;

    private Disruptor<AnalyticsResultEvent> outputDisruptor;

    @Bean
    public Disruptor<AnalyticsResultEvent> analyticsResultDisruptor() {
        WaitStrategy waitStrategy = resolveWaitStrategy();

        // anomaly passes publish from several worker threads at once
        outputDisruptor = new Disruptor<>(
                new AnalyticsResultEventFactory(),
                OUTPUT_BUFFER_SIZE,
                namedThreadFactory("disruptor-output"),
                ProducerType.MULTI,
                waitStrategy
        );

        outputDisruptor.setDefaultExceptionHandler(new WarehouseWriteExceptionHandler(meterRegistry));

        outputDisruptor.handleEventsWith(warehouseWriteHandler);
        outputDisruptor.start();

        log.info("[Disruptor] Output 파이프라인 기동: AnalyticsResult → Warehouse | size={}, wait={}",
                OUTPUT_BUFFER_SIZE, waitStrategy.getClass().getSimpleName());

        return outputDisruptor;
    }

    @Bean
    public RingBuffer<AnalyticsResultEvent> analyticsResultRingBuffer(
            Disruptor<AnalyticsResultEvent> analyticsResultDisruptor) {
        return analyticsResultDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        if (outputDisruptor != null) {
            outputDisruptor.shutdown();
            log.info("[Disruptor] Output Disruptor 종료 완료");
        }
    }

    private WaitStrategy resolveWaitStrategy() {
        for (String profile : environment.getActiveProfiles()) {
            if ("prod".equals(profile)) {
                return new BlockingWaitStrategy();
            }
        }
        return new SleepingWaitStrategy();
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
