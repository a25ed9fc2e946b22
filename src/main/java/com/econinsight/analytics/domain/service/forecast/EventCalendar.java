package com.econinsight.analytics.domain.service.forecast;

import com.econinsight.analytics.domain.service.AnalyticsProperties;
import com.econinsight.analytics.domain.service.AnalyticsProperties.CalendarEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Known recurring events (demand spikes, stimulus months, shifting holidays) that the seasonal
 * model treats as exogenous boosts on the months they fall in.
 */
@Slf4j
@Component
public class EventCalendar {

    private final Map<String, Set<YearMonth>> occurrences;

    @Autowired
    public EventCalendar(AnalyticsProperties properties) {
        this(parse(properties.getSeasonal().getEvents()));
    }

    public EventCalendar(Map<String, Set<YearMonth>> occurrences) {
        Map<String, Set<YearMonth>> copy = new LinkedHashMap<>();
        occurrences.forEach((name, months) -> copy.put(name, Collections.unmodifiableSet(new TreeSet<>(months))));
        this.occurrences = Collections.unmodifiableMap(copy);
        if (!copy.isEmpty()) {
            log.info("[EventCalendar] 이벤트 {}건 등록: {}", copy.size(), copy.keySet());
        }
    }

    public static EventCalendar empty() {
        return new EventCalendar(Map.of());
    }

    public List<String> eventNames() {
        return new ArrayList<>(occurrences.keySet());
    }

    public boolean occurs(String eventName, YearMonth month) {
        Set<YearMonth> months = occurrences.get(eventName);
        return months != null && months.contains(month);
    }

    public boolean isEmpty() {
        return occurrences.isEmpty();
    }

    private static Map<String, Set<YearMonth>> parse(List<CalendarEvent> events) {
        Map<String, Set<YearMonth>> result = new LinkedHashMap<>();
        if (events == null) return result;
        for (CalendarEvent event : events) {
            if (event.getName() == null || event.getName().isBlank()) {
                throw new IllegalArgumentException("calendar event needs a name");
            }
            Set<YearMonth> months = new TreeSet<>();
            for (String raw : event.getMonths()) {
                try {
                    months.add(YearMonth.parse(raw.trim()));
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException(
                            "calendar event " + event.getName() + " has invalid month '" + raw + "', expected yyyy-MM", e);
                }
            }
            result.put(event.getName(), months);
        }
        return result;
    }
}
