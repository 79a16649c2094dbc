package com.rebootearth.burnrisk.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Inclusive range of calendar days.
 */
@Getter
@EqualsAndHashCode
@ToString
public class DateRange {

    private final LocalDate start;
    private final LocalDate end;

    public DateRange(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Date range end " + end + " is before start " + start);
        }
        this.start = start;
        this.end = end;
    }

    public static DateRange around(LocalDate day, int pastDays, int forecastDays) {
        return new DateRange(day.minusDays(pastDays), day.plusDays(forecastDays));
    }
}
