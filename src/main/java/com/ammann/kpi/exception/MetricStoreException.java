/* (C)2026 */
package com.ammann.kpi.exception;

/**
 * Failure reported by the metric fact store, for example an insert against a
 * metric kind that has not been registered.
 */
public class MetricStoreException extends ApiException
{
    public MetricStoreException(String message)
    {
        super(message);
    }

    public static MetricStoreException unknownKind(String kind)
    {
        return new MetricStoreException(String.format("Unknown metric kind '%s'", kind));
    }
}
