package com.econinsight.analytics.domain.service.ensemble;

import com.econinsight.analytics.domain.model.EnsembleWeights;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "analytics.ensemble", name = "weighting", havingValue = "fixed", matchIfMissing = true)
public class FixedWeightsProvider implements EnsembleWeightsProvider {

    private final AnalyticsProperties properties;

    @Override
    public EnsembleWeights weightsFor(Series series, int horizon) {
        return properties.getEnsemble().toWeights();
    }

    @Override
    public String version() {
        return "fixed:" + properties.getEnsemble().toWeights().version();
    }
}
