package com.ammann.kpi.service;

import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses the optional {@code min_start} query parameter of ratio reads.
 *
 * <p>Anything that is not an ISO date like {@code 2001-07-30} is treated as if no filter had
 * been given. A malformed optional filter never fails the read.
 */
public final class MinStartFilter
{
    private static final Logger LOG = Logger.getLogger(MinStartFilter.class);

    private MinStartFilter()
    {
    }

    public static Optional<LocalDate> parse(String minStart)
    {
        if (minStart == null || minStart.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(minStart.trim()));
        } catch (DateTimeParseException e) {
            LOG.debugf("Ignoring malformed min_start '%s': %s", minStart, e.getMessage());
            return Optional.empty();
        }
    }
}
