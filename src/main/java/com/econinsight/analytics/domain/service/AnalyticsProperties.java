package com.econinsight.analytics.domain.service;

import com.econinsight.analytics.domain.model.EnsembleWeights;
import com.econinsight.analytics.domain.model.ModelTag;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    private int minHistory = 24;
    private int maxHorizon = 12;
    private int defaultHorizon = 6;

    private Seasonal seasonal = new Seasonal();
    private Autoregressive autoregressive = new Autoregressive();
    private Ensemble ensemble = new Ensemble();
    private Anomaly anomaly = new Anomaly();
    private Correlation correlation = new Correlation();
    private Schedule schedule = new Schedule();

    @Getter
    @Setter
    public static class Seasonal {
        private String version = "seasonal-v1";
        private int changepointCount = 25;
        private double changepointRange = 0.9;
        private double changepointPenalty = 0.001;
        private double intervalWidth = 0.80;
        private List<CalendarEvent> events = new ArrayList<>();
    }

    /** A known recurring event, given by the months in which it occurs (yyyy-MM). */
    @Getter
    @Setter
    public static class CalendarEvent {
        private String name;
        private List<String> months = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Autoregressive {
        private String version = "arima-v1";
        private int maxP = 2;
        private int maxQ = 2;
        private int maxDifferencing = 2;
        private int seasonalPeriod = 12;
        private SeasonalDifferencing seasonalDifferencing = SeasonalDifferencing.AUTO;
        private double seasonalStrengthThreshold = 0.64;
        private InformationCriterion criterion = InformationCriterion.AIC;
        private double confidence = 0.95;
        private int maxEvaluations = 4000;
    }

    public enum SeasonalDifferencing {
        AUTO, ALWAYS, NEVER
    }

    public enum InformationCriterion {
        AIC, BIC
    }

    @Getter
    @Setter
    public static class Ensemble {
        private Map<ModelTag, Double> weights = defaultWeights();
        private String weighting = "fixed";
        private int backtestHoldout = 6;
        private int poolSize = 4;

        public EnsembleWeights toWeights() {
            return EnsembleWeights.of(weights);
        }

        private static Map<ModelTag, Double> defaultWeights() {
            Map<ModelTag, Double> map = new EnumMap<>(ModelTag.class);
            map.put(ModelTag.SEASONAL, 0.6);
            map.put(ModelTag.AUTOREGRESSIVE, 0.4);
            return map;
        }
    }

    @Getter
    @Setter
    public static class Anomaly {
        private double contamination = 0.10;
        private int minPoints = 12;
        private int treeCount = 100;
        private int sampleSize = 256;
        private long seed = 42L;
        private int rollingWindow = 6;
    }

    @Getter
    @Setter
    public static class Correlation {
        private int minOverlap = 6;
        private int topLimit = 10;
    }

    @Getter
    @Setter
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 6 * * *";
    }
}
