package com.econinsight.analytics.infra.executor;

import com.econinsight.analytics.domain.service.AnalyticsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class AnalyticsExecutorConfig {

    @Bean(name = "analyticsExecutor", destroyMethod = "shutdown")
    public ExecutorService analyticsExecutor(AnalyticsProperties properties) {
        int poolSize = Math.max(2, properties.getEnsemble().getPoolSize());
        AtomicInteger counter = new AtomicInteger(0);
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "analytics-fit-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("[Executor] 모델 적합 풀 기동: size={}", poolSize);
        return pool;
    }
}
