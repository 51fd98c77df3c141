/* (C)2026 */
package com.ammann.kpi.model;

import com.ammann.kpi.exception.InvalidPeriodException;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Comparator;

/**
 * Calendar month bucket used to group KPI counts.
 *
 * <p>Construction does not validate the month; grouped query rows are carried as-is
 * and only rejected when they are turned into a date by {@link #firstDay()}.
 *
 * @param year  calendar year
 * @param month calendar month, expected within 1..12
 */
public record Period(int year, int month) implements Comparable<Period>
{
    private static final Comparator<Period> CHRONOLOGICAL =
            Comparator.comparingInt(Period::year).thenComparingInt(Period::month);

    public static Period of(int year, int month)
    {
        return new Period(year, month);
    }

    public static Period from(LocalDate date)
    {
        return new Period(date.getYear(), date.getMonthValue());
    }

    /**
     * Returns the first day of this month.
     *
     * @throws InvalidPeriodException if the month or year is outside calendar bounds
     */
    public LocalDate firstDay()
    {
        if (month < 1 || month > 12) {
            throw new InvalidPeriodException(year, month, null);
        }
        try {
            return LocalDate.of(year, month, 1);
        } catch (DateTimeException e) {
            throw new InvalidPeriodException(year, month, e);
        }
    }

    @Override
    public int compareTo(Period other)
    {
        return CHRONOLOGICAL.compare(this, other);
    }

    @Override
    public String toString()
    {
        return String.format("%d-%02d", year, month);
    }
}
