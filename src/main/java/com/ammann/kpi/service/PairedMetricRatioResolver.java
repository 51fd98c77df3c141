package com.ammann.kpi.service;

import com.ammann.kpi.exception.InvalidInputException;
import com.ammann.kpi.exception.StoreInconsistencyException;
import com.ammann.kpi.model.MetricObservation;
import com.ammann.kpi.model.RatioPoint;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reads and writes ratios stored as two metric fact series, one for the numerator kind and
 * one for the denominator kind.
 *
 * <p>Reads inner-join both series on the exact start date: a date for which only one side
 * exists yields no ratio. Writes store one fact per side, both covering the same week-long
 * bucket.
 */
@ApplicationScoped
public class PairedMetricRatioResolver
{
    private static final Logger LOG = Logger.getLogger(PairedMetricRatioResolver.class);

    /** Every posted ratio covers one week starting at its start date. */
    public static final int BUCKET_DAYS = 7;

    private final MetricStore metricStore;

    @Inject
    public PairedMetricRatioResolver(MetricStore metricStore)
    {
        this.metricStore = metricStore;
    }

    /**
     * Resolves the ratios of two kinds, optionally from {@code minStart} on.
     *
     * @param minStart ISO date like {@code 2001-07-30}; malformed values disable the filter
     * @return ratios ordered by start date ascending
     */
    public List<RatioPoint> resolve(String numeratorKind, String denominatorKind, String minStart)
    {
        return resolve(numeratorKind, denominatorKind, MinStartFilter.parse(minStart));
    }

    /**
     * Resolves the ratios of two kinds, optionally from {@code minStart} on.
     *
     * @return ratios ordered by start date ascending
     */
    public List<RatioPoint> resolve(String numeratorKind, String denominatorKind, Optional<LocalDate> minStart)
    {
        Map<LocalDate, Long> numerators = byStart(metricStore.query(numeratorKind, minStart));
        Map<LocalDate, Long> denominators = byStart(metricStore.query(denominatorKind, minStart));

        List<RatioPoint> points = new ArrayList<>();
        for (Map.Entry<LocalDate, Long> numerator : numerators.entrySet()) {
            Long denominator = denominators.get(numerator.getKey());
            if (denominator != null) {
                points.add(new RatioPoint(numerator.getKey(), numerator.getValue(), denominator));
            }
        }

        LOG.debugf("Resolved %d ratios of '%s'/'%s' (numerators=%d, denominators=%d, minStart=%s)",
                points.size(), numeratorKind, denominatorKind,
                numerators.size(), denominators.size(), minStart.orElse(null));
        return Collections.unmodifiableList(points);
    }

    /**
     * Stores a posted ratio given as raw request values. {@code start} is
     * {@code year-month-day}; month and day may omit the leading zero.
     *
     * @throws InvalidInputException if {@code start} is not an ISO date or a value is not a
     *                               non-negative whole number
     * @see #record(String, String, LocalDate, long, long)
     */
    public void record(String numeratorKind, String denominatorKind, String start,
                       Object numeratorValue, Object denominatorValue)
    {
        LocalDate startDate = parseStart(start);
        long numerator = parseValue("numerator", numeratorValue);
        long denominator = parseValue("denominator", denominatorValue);

        record(numeratorKind, denominatorKind, startDate, numerator, denominator);
    }

    /**
     * Stores a ratio as two facts covering {@code [start, start + 7 days)}.
     *
     * <p>The numerator fact is written first. A failure of that first write propagates as is
     * and nothing has been stored. A failure of the second write is reported as
     * {@link StoreInconsistencyException}; the numerator fact is left in place.
     *
     * @throws InvalidInputException if {@code start} is null or a value is negative
     */
    public void record(String numeratorKind, String denominatorKind, LocalDate start,
                       long numeratorValue, long denominatorValue)
    {
        if (start == null) {
            throw InvalidInputException.invalidDate("start", null, null);
        }
        if (numeratorValue < 0) {
            throw InvalidInputException.notNumeric("numerator", numeratorValue);
        }
        if (denominatorValue < 0) {
            throw InvalidInputException.notNumeric("denominator", denominatorValue);
        }

        LocalDate end = start.plusDays(BUCKET_DAYS);

        metricStore.insert(numeratorKind, start, end, numeratorValue);
        try {
            metricStore.insert(denominatorKind, start, end, denominatorValue);
        } catch (RuntimeException e) {
            throw new StoreInconsistencyException(numeratorKind, denominatorKind, start, e);
        }

        LOG.debugf("Recorded %d/%d for '%s'/'%s' from %s to %s",
                numeratorValue, denominatorValue, numeratorKind, denominatorKind, start, end);
    }

    private static Map<LocalDate, Long> byStart(List<MetricObservation> observations)
    {
        Map<LocalDate, Long> byStart = new TreeMap<>();
        for (MetricObservation observation : observations) {
            byStart.put(observation.start(), observation.value());
        }
        return byStart;
    }

    /**
     * Parses {@code year-month-day} with or without zero padding, e.g. {@code 2021-1-4}.
     */
    static LocalDate parseStart(String start)
    {
        if (start == null) {
            throw InvalidInputException.invalidDate("start", null, null);
        }
        String[] parts = start.trim().split("-", -1);
        if (parts.length != 3) {
            throw InvalidInputException.invalidDate("start", start, null);
        }
        try {
            return LocalDate.of(
                    Integer.parseInt(parts[0]),
                    Integer.parseInt(parts[1]),
                    Integer.parseInt(parts[2]));
        } catch (NumberFormatException | DateTimeException e) {
            throw InvalidInputException.invalidDate("start", start, e);
        }
    }

    private static long parseValue(String field, Object value)
    {
        if (value == null || value instanceof Boolean) {
            throw InvalidInputException.notNumeric(field, value);
        }
        try {
            BigInteger whole = new BigDecimal(value.toString().trim()).toBigIntegerExact();
            if (whole.signum() < 0) {
                throw InvalidInputException.notNumeric(field, value);
            }
            return whole.longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw InvalidInputException.notNumeric(field, value, e);
        }
    }
}
