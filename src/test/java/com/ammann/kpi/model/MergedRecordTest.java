package com.ammann.kpi.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MergedRecordTest
{

    @Test
    void countsAreCopiedAndImmutable()
    {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("votes", 3L);
        counts.put("helpful", 2L);

        MergedRecord record = new MergedRecord(LocalDate.of(2021, 1, 1), counts);
        counts.put("votes", 99L);

        assertThat(record.count("votes")).isEqualTo(3L);
        assertThat(record.counts()).containsOnlyKeys("votes", "helpful");
        assertThat(record.counts().keySet()).containsExactly("votes", "helpful");
        assertThatThrownBy(() -> record.counts().put("x", 1L))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void countOfUnknownSeriesIsZero()
    {
        MergedRecord record = new MergedRecord(LocalDate.of(2021, 1, 1), Map.of("votes", 3L));

        assertThat(record.count("helpful")).isZero();
    }
}
