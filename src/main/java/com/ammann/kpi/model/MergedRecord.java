/* (C)2026 */
package com.ammann.kpi.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of a merged report: the first day of a month and a count for every series
 * that took part in the merge.
 *
 * @param date   first day of the month
 * @param counts series name to count, in the order the series were requested
 */
public record MergedRecord(LocalDate date, Map<String, Long> counts)
{
    public MergedRecord
    {
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    /**
     * Returns the count of the named series, or 0 when the series is not part of this record.
     */
    public long count(String series)
    {
        return counts.getOrDefault(series, 0L);
    }
}
