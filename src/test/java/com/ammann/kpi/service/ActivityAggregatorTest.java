package com.ammann.kpi.service;

import com.ammann.kpi.model.ActorEvent;
import com.ammann.kpi.model.LocalePartition;
import com.ammann.kpi.model.Period;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActivityAggregatorTest
{
    private final ActivityAggregator aggregator = new ActivityAggregator();

    @Test
    void countsDistinctActorsPerMonth()
    {
        List<ActorEvent> events = List.of(
                ActorEvent.of(2021, 1, 1L),
                ActorEvent.of(2021, 1, 1L),
                ActorEvent.of(2021, 1, 2L),
                ActorEvent.of(2021, 2, 1L));

        Map<Period, Long> counts = aggregator.distinctActive(events, 1);

        assertThat(counts).containsExactly(
                Map.entry(Period.of(2021, 1), 2L),
                Map.entry(Period.of(2021, 2), 1L));
    }

    @Test
    void thresholdRequiresEnoughEventsInTheSameMonth()
    {
        List<ActorEvent> events = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            events.add(ActorEvent.of(2021, 1, 1L));
        }
        events.add(ActorEvent.of(2021, 1, 2L));
        events.add(ActorEvent.of(2021, 2, 2L));
        events.add(ActorEvent.of(2021, 2, 2L));

        Map<Period, Long> counts = aggregator.distinctActive(events, 3);

        assertThat(counts).containsExactly(Map.entry(Period.of(2021, 1), 1L));
    }

    @Test
    void raisingTheThresholdNeverRaisesACount()
    {
        List<ActorEvent> events = new ArrayList<>();
        for (long actor = 1; actor <= 5; actor++) {
            for (int n = 0; n < actor * 2; n++) {
                events.add(ActorEvent.of(2021, (int) (actor % 2) + 1, actor));
            }
        }

        for (int threshold = 1; threshold < 12; threshold++) {
            Map<Period, Long> lower = aggregator.distinctActive(events, threshold);
            Map<Period, Long> higher = aggregator.distinctActive(events, threshold + 1);
            higher.forEach((period, count) -> assertThat(count).isLessThanOrEqualTo(lower.get(period)));
        }
    }

    @Test
    void ignoresEventsWithoutActor()
    {
        List<ActorEvent> events = List.of(
                ActorEvent.of(2021, 1, null),
                ActorEvent.of(2021, 1, null),
                ActorEvent.of(2021, 2, 7L));

        assertThat(aggregator.distinctActive(events, 1))
                .containsExactly(Map.entry(Period.of(2021, 2), 1L));
    }

    @Test
    void partitionsByLocaleAndCountsActorsOnBothSides()
    {
        List<ActorEvent> events = List.of(
                ActorEvent.of(2021, 1, 1L, "en-US"),
                ActorEvent.of(2021, 1, 1L, "de"),
                ActorEvent.of(2021, 1, 2L, "de"),
                ActorEvent.of(2021, 1, null, "en-US"),
                ActorEvent.of(2021, 2, 3L, "fr"));

        LocalePartition partition = aggregator.distinctActive(events, 1, "en-US"::equals);

        assertThat(partition.matching()).containsExactly(Map.entry(Period.of(2021, 1), 1L));
        assertThat(partition.nonMatching()).containsExactly(
                Map.entry(Period.of(2021, 1), 2L),
                Map.entry(Period.of(2021, 2), 1L));
    }

    @Test
    void emptyInputYieldsEmptyCounts()
    {
        assertThat(aggregator.distinctActive(List.of(), 1)).isEmpty();
        LocalePartition partition = aggregator.distinctActive(List.of(), 1, "en-US"::equals);
        assertThat(partition.matching()).isEmpty();
        assertThat(partition.nonMatching()).isEmpty();
    }

    @Test
    void rejectsThresholdBelowOne()
    {
        assertThatThrownBy(() -> aggregator.distinctActive(List.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> aggregator.distinctActive(List.of(), -1, l -> true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
