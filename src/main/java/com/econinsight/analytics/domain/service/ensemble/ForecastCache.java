package com.econinsight.analytics.domain.service.ensemble;

import com.econinsight.analytics.domain.model.Forecast;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoised ensemble forecasts. A key embeds the data fingerprint and every version involved,
 * so an entry is never stale; older keys for a series are dropped when a new one is stored.
 */
@Component
public class ForecastCache {

    private final Map<ForecastCacheKey, Forecast> entries = new ConcurrentHashMap<>();

    public Optional<Forecast> get(ForecastCacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void put(ForecastCacheKey key, Forecast forecast) {
        entries.keySet().removeIf(k -> k.seriesId().equals(key.seriesId())
                && k.horizon() == key.horizon() && !k.equals(key));
        entries.put(key, forecast);
    }

    public void evict(String seriesId) {
        entries.keySet().removeIf(k -> k.seriesId().equals(seriesId));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
