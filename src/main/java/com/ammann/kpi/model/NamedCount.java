/* (C)2026 */
package com.ammann.kpi.model;

/**
 * One data point of a grouped source series.
 *
 * @param period month the events fall into
 * @param count  number of events in that month, never negative
 */
public record NamedCount(Period period, long count) {

    public static NamedCount of(int year, int month, long count) {
        return new NamedCount(new Period(year, month), count);
    }
}
