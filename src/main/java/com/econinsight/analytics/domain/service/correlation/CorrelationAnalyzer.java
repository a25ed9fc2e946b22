package com.econinsight.analytics.domain.service.correlation;

import com.econinsight.analytics.domain.model.AlignedWindow;
import com.econinsight.analytics.domain.model.CorrelationEdge;
import com.econinsight.analytics.domain.model.Observation;
import com.econinsight.analytics.domain.model.Series;
import com.econinsight.analytics.domain.service.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pairwise Pearson correlation over the months two series share. Pairs with too little overlap are
 * left out; a pair where either side is flat over the shared months gets an undefined (NaN) coefficient.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrelationAnalyzer {

    /** Strongest first, undefined last, then by ids for a stable order. */
    public static final Comparator<CorrelationEdge> BY_STRENGTH = Comparator
            .comparingDouble((CorrelationEdge e) -> e.isDefined() ? -Math.abs(e.coefficient()) : Double.POSITIVE_INFINITY)
            .thenComparing(CorrelationEdge::seriesA)
            .thenComparing(CorrelationEdge::seriesB);

    private final AnalyticsProperties properties;

    public List<CorrelationEdge> analyze(Collection<Series> seriesSet) {
        List<Series> sorted = seriesSet.stream()
                .sorted(Comparator.comparing(Series::getId))
                .toList();

        List<Series[]> pairs = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = i + 1; j < sorted.size(); j++) {
                pairs.add(new Series[]{sorted.get(i), sorted.get(j)});
            }
        }

        List<CorrelationEdge> edges = pairs.parallelStream()
                .map(pair -> {
                    try {
                        return correlate(pair[0], pair[1]).orElse(null);
                    } catch (RuntimeException e) {
                        log.warn("[Correlation] 쌍 계산 실패: {}/{}, reason={}",
                                pair[0].getId(), pair[1].getId(), e.getMessage());
                        return null;
                    }
                })
                .filter(Objects::nonNull)
                .sorted(BY_STRENGTH)
                .toList();

        log.info("[Correlation] 분석 완료: series={}, pairs={}, edges={}", sorted.size(), pairs.size(), edges.size());
        return edges;
    }

    /** Empty when the two series share fewer months than the configured minimum. */
    public Optional<CorrelationEdge> correlate(Series a, Series b) {
        List<Observation> left = a.getObservations();
        List<Observation> right = b.getObservations();
        int capacity = Math.min(left.size(), right.size());
        double[] x = new double[capacity];
        double[] y = new double[capacity];
        Observation first = null;
        Observation last = null;

        int i = 0;
        int j = 0;
        int shared = 0;
        while (i < left.size() && j < right.size()) {
            int cmp = left.get(i).month().compareTo(right.get(j).month());
            if (cmp < 0) {
                i++;
            } else if (cmp > 0) {
                j++;
            } else {
                if (first == null) first = left.get(i);
                last = left.get(i);
                x[shared] = left.get(i).value();
                y[shared] = right.get(j).value();
                shared++;
                i++;
                j++;
            }
        }

        int minOverlap = properties.getCorrelation().getMinOverlap();
        if (shared < minOverlap) {
            log.debug("[Correlation] 겹치는 기간 부족으로 제외: {}/{}, shared={}, min={}",
                    a.getId(), b.getId(), shared, minOverlap);
            return Optional.empty();
        }

        double[] xs = Arrays.copyOf(x, shared);
        double[] ys = Arrays.copyOf(y, shared);
        double coefficient = isFlat(xs) || isFlat(ys)
                ? Double.NaN
                : clamp(new PearsonsCorrelation().correlation(xs, ys));

        AlignedWindow window = new AlignedWindow(shared, first.date(), last.date());
        return Optional.of(new CorrelationEdge(a.getId(), b.getId(), coefficient, window));
    }

    public static List<CorrelationEdge> strongestFor(String seriesId, List<CorrelationEdge> edges, int limit) {
        return edges.stream()
                .filter(e -> e.involves(seriesId) && e.isDefined())
                .sorted(BY_STRENGTH)
                .limit(limit)
                .toList();
    }

    private static boolean isFlat(double[] values) {
        for (double v : values) {
            if (v != values[0]) return false;
        }
        return true;
    }

    private static double clamp(double r) {
        if (Double.isNaN(r)) return r;
        return Math.max(-1.0, Math.min(1.0, r));
    }
}
