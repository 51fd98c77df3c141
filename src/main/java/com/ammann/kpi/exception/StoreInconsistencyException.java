/* (C)2026 */
package com.ammann.kpi.exception;

import java.time.LocalDate;

/**
 * The first fact of a paired observation was written but the second one failed.
 *
 * <p>No compensating delete is attempted; the store remains the source of truth and
 * callers decide how to repair the half-written pair.
 */
public class StoreInconsistencyException extends ApiException
{
    private final String writtenKind;
    private final String failedKind;
    private final LocalDate start;

    public StoreInconsistencyException(String writtenKind, String failedKind, LocalDate start, Throwable cause)
    {
        super(String.format(
                "Partial write for period starting %s: '%s' was stored but '%s' failed",
                start, writtenKind, failedKind), cause);
        this.writtenKind = writtenKind;
        this.failedKind = failedKind;
        this.start = start;
    }

    public String getWrittenKind()
    {
        return writtenKind;
    }

    public String getFailedKind()
    {
        return failedKind;
    }

    public LocalDate getStart()
    {
        return start;
    }
}
