package com.econinsight.analytics.domain.service.forecast;

import com.econinsight.analytics.domain.exception.InsufficientHistoryException;
import com.econinsight.analytics.domain.model.Series;
import org.apache.commons.math3.distribution.NormalDistribution;

import java.time.LocalDate;
import java.time.YearMonth;

public final class ForecastSupport {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    private ForecastSupport() {
    }

    public static void validateHorizon(int horizon, int maxHorizon) {
        if (horizon < 1 || horizon > maxHorizon) {
            throw new IllegalArgumentException(
                    "horizon must be between 1 and " + maxHorizon + " months, got " + horizon);
        }
    }

    public static void requireHistory(Series series, int minHistory) {
        if (series.size() < minHistory) {
            throw new InsufficientHistoryException(series.getId(), series.size(), minHistory);
        }
    }

    /**
     * Date of forecast step {@code step} (1-based), {@code step} calendar months after the last observation.
     * Month-end dated series stay on month ends; otherwise the day of month is kept where the month allows.
     */
    public static LocalDate stepDate(Series series, int step) {
        LocalDate last = series.last().date();
        YearMonth month = YearMonth.from(last).plusMonths(step);
        if (last.getDayOfMonth() == last.lengthOfMonth()) {
            return month.atEndOfMonth();
        }
        return month.atDay(Math.min(last.getDayOfMonth(), month.lengthOfMonth()));
    }

    /** Two-sided standard normal quantile for a central interval of the given coverage. */
    public static double zScore(double coverage) {
        if (!(coverage > 0.0 && coverage < 1.0)) {
            throw new IllegalArgumentException("interval coverage must be in (0, 1), got " + coverage);
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(0.5 + coverage / 2.0);
    }
}
