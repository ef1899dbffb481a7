package com.timexforecast.series;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Fixed sampling step of a series, with the seasonal period that is assumed
 * for it when the caller does not override one.
 */
public enum SamplingFrequency {
    MINUTELY(ChronoUnit.MINUTES, 60),
    HOURLY(ChronoUnit.HOURS, 24),
    DAILY(ChronoUnit.DAYS, 7),
    WEEKLY(ChronoUnit.WEEKS, 52),
    MONTHLY(ChronoUnit.MONTHS, 12),
    YEARLY(ChronoUnit.YEARS, 1);

    private final ChronoUnit unit;
    private final int defaultSeasonalPeriod;

    SamplingFrequency(ChronoUnit unit, int defaultSeasonalPeriod) {
        this.unit = unit;
        this.defaultSeasonalPeriod = defaultSeasonalPeriod;
    }

    public LocalDateTime advance(LocalDateTime timestamp, int steps) {
        return timestamp.plus(steps, unit);
    }

    public int defaultSeasonalPeriod() {
        return defaultSeasonalPeriod;
    }
}
