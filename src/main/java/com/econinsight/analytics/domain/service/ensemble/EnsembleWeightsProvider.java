package com.econinsight.analytics.domain.service.ensemble;

import com.econinsight.analytics.domain.model.EnsembleWeights;
import com.econinsight.analytics.domain.model.Series;

/**
 * Source of blending weights. Implementations must return weights for every sub-model.
 */
public interface EnsembleWeightsProvider {

    EnsembleWeights weightsFor(Series series, int horizon);

    /** Changes whenever the weights a provider would hand out change, so cached blends are invalidated. */
    String version();
}
