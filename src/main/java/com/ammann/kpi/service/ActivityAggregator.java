package com.ammann.kpi.service;

import com.ammann.kpi.model.ActorEvent;
import com.ammann.kpi.model.LocalePartition;
import com.ammann.kpi.model.Period;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Counts distinct active users per month.
 *
 * <p>A user is active in a month when they have at least {@code threshold} events in that
 * month. Events without a user id are ignored. Months without any active user are left out
 * of the result.
 */
@ApplicationScoped
public class ActivityAggregator
{
    private static final Logger LOG = Logger.getLogger(ActivityAggregator.class);

    /**
     * Distinct active users per month.
     *
     * @param threshold minimum number of events per user and month, at least 1
     */
    public Map<Period, Long> distinctActive(Collection<ActorEvent> events, int threshold)
    {
        requireValidThreshold(threshold);

        Map<Period, Map<Long, Integer>> perActor = new HashMap<>();
        for (ActorEvent event : events) {
            tally(perActor, event);
        }
        return countQualifying(perActor, threshold);
    }

    /**
     * Distinct active users per month, counted separately for events whose locale matches
     * {@code localeFilter} and for all other events. A user contributing to both sides is
     * counted on both sides.
     *
     * @param threshold minimum number of events per user, month and side, at least 1
     */
    public LocalePartition distinctActive(Collection<ActorEvent> events, int threshold,
                                          Predicate<String> localeFilter)
    {
        requireValidThreshold(threshold);

        Map<Period, Map<Long, Integer>> matching = new HashMap<>();
        Map<Period, Map<Long, Integer>> nonMatching = new HashMap<>();
        for (ActorEvent event : events) {
            tally(localeFilter.test(event.locale()) ? matching : nonMatching, event);
        }

        LocalePartition partition = new LocalePartition(
                countQualifying(matching, threshold),
                countQualifying(nonMatching, threshold));

        LOG.debugf("Partitioned %d events into %d matching and %d non-matching months",
                events.size(), partition.matching().size(), partition.nonMatching().size());
        return partition;
    }

    private static void tally(Map<Period, Map<Long, Integer>> perActor, ActorEvent event)
    {
        if (event.actorId() == null) {
            return;
        }
        perActor.computeIfAbsent(event.period(), p -> new HashMap<>())
                .merge(event.actorId(), 1, Integer::sum);
    }

    private static Map<Period, Long> countQualifying(Map<Period, Map<Long, Integer>> perActor, int threshold)
    {
        Map<Period, Long> counts = new TreeMap<>();
        perActor.forEach((period, actors) -> {
            long active = actors.values().stream().filter(n -> n >= threshold).count();
            if (active > 0) {
                counts.put(period, active);
            }
        });
        return counts;
    }

    private static void requireValidThreshold(int threshold)
    {
        if (threshold < 1) {
            throw new IllegalArgumentException("Activity threshold must be at least 1, got " + threshold);
        }
    }
}
