/* (C)2026 */
package com.ammann.kpi.model;

import java.time.LocalDate;

/**
 * Start date and value of a stored metric fact, as returned by a metric store query.
 */
public record MetricObservation(LocalDate start, long value) {}
