package com.econinsight.analytics.domain.model;

public enum CategoryType {
    CORE_SPENDING,
    RETAIL_CHANNEL,
    ECONOMIC_CONTEXT
}
