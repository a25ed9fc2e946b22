package com.econinsight.analytics.domain.model;

public enum ModelTag {
    SEASONAL,
    AUTOREGRESSIVE,
    ENSEMBLE;

    public boolean isSubModel() {
        return this != ENSEMBLE;
    }
}
