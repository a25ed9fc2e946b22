package com.econinsight.analytics.domain.service.ensemble;

import com.econinsight.analytics.domain.model.EnsembleWeights;
import com.econinsight.analytics.domain.model.Forecast;
import com.econinsight.analytics.domain.model.ModelTag;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import com.econinsight.analytics.domain.service.forecast.ForecastModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weights each sub-model by the inverse of its mean absolute error on a holdout of the most recent
 * observations. Falls back to the configured fixed weights when the holdout cannot be scored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "analytics.ensemble", name = "weighting", havingValue = "backtest")
public class BacktestWeightsProvider implements EnsembleWeightsProvider {

    private static final double MIN_ERROR = 1e-9;

    private final AnalyticsProperties properties;
    private final List<ForecastModel> models;

    @Override
    public EnsembleWeights weightsFor(Series series, int horizon) {
        EnsembleWeights fallback = properties.getEnsemble().toWeights();
        int holdout = properties.getEnsemble().getBacktestHoldout();
        if (series.hasGaps() || series.size() - holdout < properties.getMinHistory()) {
            log.debug("[Backtest] 홀드아웃 불가, 고정 가중치 사용: series={}, n={}", series.getId(), series.size());
            return fallback;
        }

        Series training = series.head(series.size() - holdout);
        double[] actual = series.values();
        int offset = training.size();

        Map<ModelTag, Double> raw = new EnumMap<>(ModelTag.class);
        for (ForecastModel model : models) {
            try {
                Forecast backtest = model.forecast(training, holdout);
                double[] predicted = backtest.pointEstimates();
                double mae = 0.0;
                for (int h = 0; h < holdout; h++) mae += Math.abs(predicted[h] - actual[offset + h]);
                mae /= holdout;
                raw.put(model.tag(), 1.0 / Math.max(mae, MIN_ERROR));
            } catch (RuntimeException e) {
                log.debug("[Backtest] {} 백테스트 실패: series={}, reason={}", model.tag(), series.getId(), e.getMessage());
                raw.put(model.tag(), 0.0);
            }
        }

        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0) return fallback;
        EnsembleWeights weights = EnsembleWeights.of(raw);
        log.debug("[Backtest] 가중치 산출: series={}, weights={}", series.getId(), weights.version());
        return weights;
    }

    @Override
    public String version() {
        return "backtest:h" + properties.getEnsemble().getBacktestHoldout();
    }
}
