package com.econinsight.analytics.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One monthly indicator series. Observations are strictly increasing by calendar month;
 * missing months stay missing and are never re-indexed.
 */
@Getter
public class Series {

    private final String id;
    private final String displayName;
    private final CategoryType category;
    private final List<Observation> observations;

    @Builder
    private Series(String id, String displayName, CategoryType category, List<Observation> observations) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("series id must not be blank");
        }
        if (observations == null) {
            throw new IllegalArgumentException("series " + id + " has no observation list");
        }
        for (int i = 1; i < observations.size(); i++) {
            YearMonth prev = observations.get(i - 1).month();
            YearMonth curr = observations.get(i).month();
            if (!curr.isAfter(prev)) {
                throw new IllegalArgumentException(String.format(
                        "series %s is not strictly increasing by month: %s follows %s", id, curr, prev));
            }
        }
        this.id = id;
        this.displayName = displayName != null ? displayName : id;
        this.category = category;
        this.observations = List.copyOf(observations);
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public double[] values() {
        double[] values = new double[observations.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = observations.get(i).value();
        }
        return values;
    }

    public Observation first() {
        requireNotEmpty();
        return observations.get(0);
    }

    public Observation last() {
        requireNotEmpty();
        return observations.get(observations.size() - 1);
    }

    /** Months elapsed since the first observation, per observation. Gaps show up as jumps. */
    public long[] monthOffsets() {
        long[] offsets = new long[observations.size()];
        if (offsets.length == 0) return offsets;
        YearMonth origin = first().month();
        for (int i = 0; i < offsets.length; i++) {
            offsets[i] = ChronoUnit.MONTHS.between(origin, observations.get(i).month());
        }
        return offsets;
    }

    public boolean hasGaps() {
        if (observations.size() < 2) return false;
        long span = ChronoUnit.MONTHS.between(first().month(), last().month());
        return span != observations.size() - 1;
    }

    /** The longest run of consecutive months that ends at the last observation. */
    public Series trailingContiguousRun() {
        if (!hasGaps()) return this;
        int start = observations.size() - 1;
        while (start > 0 && observations.get(start - 1).month().plusMonths(1).equals(observations.get(start).month())) {
            start--;
        }
        return withObservations(observations.subList(start, observations.size()));
    }

    /** The first {@code count} observations, used for holdout backtests. */
    public Series head(int count) {
        if (count < 0 || count > observations.size()) {
            throw new IllegalArgumentException("series " + id + " has " + observations.size()
                    + " observations, cannot take " + count);
        }
        return withObservations(observations.subList(0, count));
    }

    public List<Observation> tail(int count) {
        int from = Math.max(0, observations.size() - count);
        return observations.subList(from, observations.size());
    }

    public List<Observation> between(LocalDate from, LocalDate to) {
        List<Observation> result = new ArrayList<>();
        for (Observation o : observations) {
            if (!o.date().isBefore(from) && !o.date().isAfter(to)) {
                result.add(o);
            }
        }
        return result;
    }

    /** Identifies the data a fit was computed on; changes whenever an observation changes. */
    public String fingerprint() {
        if (observations.isEmpty()) return id + "@empty";
        return id + "@" + observations.size() + ":" + last().date() + ":" + Arrays.hashCode(values());
    }

    private Series withObservations(List<Observation> subset) {
        return Series.builder()
                .id(id)
                .displayName(displayName)
                .category(category)
                .observations(new ArrayList<>(subset))
                .build();
    }

    private void requireNotEmpty() {
        if (observations.isEmpty()) {
            throw new IllegalStateException("series " + id + " has no observations");
        }
    }

    @Override
    public String toString() {
        return "Series{id=" + id + ", size=" + observations.size()
                + (observations.isEmpty() ? "" : ", range=" + first().date() + ".." + last().date()) + "}";
    }
}
