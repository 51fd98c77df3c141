package com.ammann.kpi.service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Start of the period covered by the monthly KPI reports.
 */
public final class ReportWindow
{
    private ReportWindow()
    {
    }

    /**
     * First day of the month that contains the day {@code lookbackDays} before today.
     */
    public static LocalDate startDate(Clock clock, int lookbackDays)
    {
        return LocalDate.now(clock).minusDays(lookbackDays).withDayOfMonth(1);
    }
}
