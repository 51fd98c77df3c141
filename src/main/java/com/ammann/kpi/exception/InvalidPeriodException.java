/* (C)2026 */
package com.ammann.kpi.exception;

/**
 * A (year, month) pair produced by an upstream grouped-count query lies outside
 * calendar bounds and cannot be turned into a date.
 *
 * <p>This is a contract violation of the data source, not a client error, and is
 * mapped to HTTP 500 by {@link GlobalExceptionHandler}.
 */
public class InvalidPeriodException extends ApiException
{
    private final int year;
    private final int month;

    public InvalidPeriodException(int year, int month, Throwable cause)
    {
        super(String.format("Invalid period %d-%02d: month must be within 1..12", year, month), cause);
        this.year = year;
        this.month = month;
    }

    public int getYear()
    {
        return year;
    }

    public int getMonth()
    {
        return month;
    }
}
