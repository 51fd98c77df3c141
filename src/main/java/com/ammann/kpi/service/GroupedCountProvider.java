package com.ammann.kpi.service;

import com.ammann.kpi.enumeration.CountSource;
import com.ammann.kpi.model.NamedCount;

import java.time.LocalDate;
import java.util.List;

/**
 * Monthly event counts of one source, for events on or after a start date.
 *
 * <p>Months without events may be absent from the result. At most one count per month is
 * expected, in no particular order.
 */
public interface GroupedCountProvider
{
    List<NamedCount> groupedCounts(CountSource source, LocalDate since);
}
