package com.ammann.kpi.service;

import com.ammann.kpi.model.MergedRecord;
import com.ammann.kpi.model.NamedCount;
import com.ammann.kpi.model.Period;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Merges several sparse, month-keyed count series into one dense report.
 *
 * <p>Every month that appears in at least one series yields exactly one {@link MergedRecord}.
 * Each record carries a count for every requested series; a series without data for that
 * month contributes 0. Records are returned most recent first.
 *
 * <p>The engine is stateless and safe to share between concurrent requests.
 */
@ApplicationScoped
public class SeriesMergeEngine
{
    private static final Logger LOG = Logger.getLogger(SeriesMergeEngine.class);

    private static final long ZERO = 0L;

    /**
     * Merges the named series into one record per month.
     *
     * @param namedSeries series name to its (month, count) points; iteration order of the map
     *                    determines the order of the counts in each record
     * @return one record per month in the union of all series, sorted by date descending
     * @throws com.ammann.kpi.exception.InvalidPeriodException if a point carries a month outside 1..12
     * @throws IllegalArgumentException if a series name or series is {@code null}
     */
    public List<MergedRecord> merge(Map<String, ? extends Collection<NamedCount>> namedSeries)
    {
        if (namedSeries == null || namedSeries.isEmpty()) {
            return List.of();
        }

        Map<String, Map<Period, Long>> indexed = new LinkedHashMap<>();
        TreeSet<Period> allPeriods = new TreeSet<>(Comparator.reverseOrder());

        for (Map.Entry<String, ? extends Collection<NamedCount>> series : namedSeries.entrySet()) {
            if (series.getKey() == null || series.getValue() == null) {
                throw new IllegalArgumentException("Series name and series must not be null");
            }

            Map<Period, Long> byPeriod = new HashMap<>();
            for (NamedCount point : series.getValue()) {
                // last write wins on duplicate months
                byPeriod.put(point.period(), point.count());
            }
            indexed.put(series.getKey(), byPeriod);
            allPeriods.addAll(byPeriod.keySet());
        }

        List<MergedRecord> records = new ArrayList<>(allPeriods.size());
        for (Period period : allPeriods) {
            LocalDate date = period.firstDay();

            Map<String, Long> counts = new LinkedHashMap<>();
            indexed.forEach((name, byPeriod) -> counts.put(name, byPeriod.getOrDefault(period, ZERO)));

            records.add(new MergedRecord(date, counts));
        }

        LOG.debugf("Merged %d series into %d monthly records", indexed.size(), records.size());
        return Collections.unmodifiableList(records);
    }
}
