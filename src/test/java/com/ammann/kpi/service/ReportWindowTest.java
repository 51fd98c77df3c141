package com.ammann.kpi.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ReportWindowTest
{
    @Test
    void startsAtFirstOfMonthOfLookbackDay()
    {
        Clock clock = Clock.fixed(Instant.parse("2021-03-15T10:00:00Z"), ZoneOffset.UTC);

        assertThat(ReportWindow.startDate(clock, 365)).isEqualTo(LocalDate.of(2020, 3, 1));
        assertThat(ReportWindow.startDate(clock, 14)).isEqualTo(LocalDate.of(2021, 3, 1));
        assertThat(ReportWindow.startDate(clock, 15)).isEqualTo(LocalDate.of(2021, 2, 1));
    }
}
