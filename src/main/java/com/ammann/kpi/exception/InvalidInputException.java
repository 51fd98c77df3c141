/* (C)2026 */
package com.ammann.kpi.exception;

/**
 * Raised by the ratio write path when a posted observation cannot be turned into
 * metric facts: the start date does not parse, or a value is not a non-negative
 * whole number.
 */
public class InvalidInputException extends ValidationException
{
    public InvalidInputException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public static InvalidInputException invalidDate(String field, Object value, Throwable cause)
    {
        return new InvalidInputException(
                String.format("Invalid input '%s': got '%s', expected a date like 2021-01-04",
                        field, value), cause);
    }

    public static InvalidInputException notNumeric(String field, Object value)
    {
        return notNumeric(field, value, null);
    }

    public static InvalidInputException notNumeric(String field, Object value, Throwable cause)
    {
        return new InvalidInputException(
                String.format("Invalid input '%s': got '%s', expected a non-negative whole number",
                        field, value), cause);
    }
}
