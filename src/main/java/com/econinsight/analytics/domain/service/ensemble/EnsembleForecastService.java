package com.econinsight.analytics.domain.service.ensemble;

import com.econinsight.analytics.domain.model.EnsembleWeights;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ModelTag;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import com.econinsight.analytics.domain.service.forecast.ForecastModel;
import com.econinsight.analytics.domain.service.forecast.ForecastSupport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Fits every sub-model for a series concurrently, waits for all of them and blends the outcomes.
 * One model failing never cancels the other; the combiner decides what survives.
 */
@Slf4j
@Service
public class EnsembleForecastService {

    private final List<ForecastModel> models;
    private final EnsembleCombiner combiner;
    private final EnsembleWeightsProvider weightsProvider;
    private final ForecastCache cache;
    private final AnalyticsProperties properties;
    private final ExecutorService analyticsExecutor;
    private final MeterRegistry meterRegistry;

    public EnsembleForecastService(List<ForecastModel> models,
                                   EnsembleCombiner combiner,
                                   EnsembleWeightsProvider weightsProvider,
                                   ForecastCache cache,
                                   AnalyticsProperties properties,
                                   @Qualifier("analyticsExecutor") ExecutorService analyticsExecutor,
                                   MeterRegistry meterRegistry) {
        this.models = models.stream()
                .sorted(Comparator.comparing(ForecastModel::tag))
                .toList();
        this.combiner = combiner;
        this.weightsProvider = weightsProvider;
        this.cache = cache;
        this.properties = properties;
        this.analyticsExecutor = analyticsExecutor;
        this.meterRegistry = meterRegistry;
    }

    public Forecast forecast(Series series, int horizon) {
        ForecastSupport.validateHorizon(horizon, properties.getMaxHorizon());

        ForecastCacheKey key = cacheKey(series, horizon);
        Optional<Forecast> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("[Ensemble] 캐시 적중: series={}, h={}", series.getId(), horizon);
            return cached.get();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        List<SubModelResult> results = fitAll(series, horizon);
        EnsembleWeights weights = weightsProvider.weightsFor(series, horizon);

        Forecast forecast;
        try {
            forecast = combiner.combine(series.getId(), results, weights);
        } catch (RuntimeException e) {
            counter("analytics.ensemble.unavailable").increment();
            throw e;
        } finally {
            sample.stop(Timer.builder("analytics.ensemble.duration")
                    .description("Fan-out, join and blend time per series")
                    .register(meterRegistry));
        }

        if (forecast.isDegraded()) {
            counter("analytics.ensemble.degraded").increment();
        }
        cache.put(key, forecast);

        log.info("[Ensemble] 예측 완료: series={}, h={}, models={}, degraded={}, next={}",
                series.getId(), horizon, forecast.getContributingModels(), forecast.isDegraded(),
                String.format("%.3f", forecast.pointAt(1).pointEstimate()));
        return forecast;
    }

    List<SubModelResult> fitAll(Series series, int horizon) {
        List<CompletableFuture<SubModelResult>> futures = new ArrayList<>(models.size());
        for (ForecastModel model : models) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> timedFit(model, series, horizon), analyticsExecutor)
                    .handle((forecast, ex) -> {
                        if (ex == null) return SubModelResult.success(forecast);
                        RuntimeException cause = unwrap(ex);
                        counter("analytics.model.failures", "model", model.tag().name()).increment();
                        log.warn("[Ensemble] 하위 모델 실패: series={}, model={}, reason={}",
                                series.getId(), model.tag(), cause.getMessage());
                        return SubModelResult.failure(model.tag(), cause);
                    }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SubModelResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<SubModelResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private Forecast timedFit(ForecastModel model, Series series, int horizon) {
        Timer timer = Timer.builder("analytics.model.fit")
                .tag("model", model.tag().name())
                .description("Sub-model fit and forecast time")
                .register(meterRegistry);
        return timer.record(() -> model.forecast(series, horizon));
    }

    private ForecastCacheKey cacheKey(Series series, int horizon) {
        String modelVersion = models.stream()
                .map(m -> m.tag() + ":" + m.version())
                .collect(Collectors.joining(","));
        return new ForecastCacheKey(series.getId(), horizon, modelVersion,
                weightsProvider.version(), series.fingerprint());
    }

    private Counter counter(String name, String... tags) {
        return Counter.builder(name).tags(tags).register(meterRegistry);
    }

    private static RuntimeException unwrap(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof RuntimeException runtime) return runtime;
        return new IllegalStateException(cause.getMessage(), cause);
    }

    public List<ModelTag> modelTags() {
        return models.stream().map(ForecastModel::tag).toList();
    }
}
