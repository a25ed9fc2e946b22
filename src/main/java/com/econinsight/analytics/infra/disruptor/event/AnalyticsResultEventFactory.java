package com.econinsight.analytics.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class AnalyticsResultEventFactory implements EventFactory<AnalyticsResultEvent> {

    @Override
    public AnalyticsResultEvent newInstance() {
        return new AnalyticsResultEvent();
    }
}
