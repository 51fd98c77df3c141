/* (C)2026 */
package com.ammann.kpi.model;

import java.time.LocalDate;

/**
 * Numerator and denominator facts that share the same start date.
 *
 * @param start       start of the bucket both facts belong to
 * @param numerator   value of the numerator fact
 * @param denominator value of the denominator fact
 */
public record RatioPoint(LocalDate start, long numerator, long denominator) {}
