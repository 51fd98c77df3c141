/* (C)2026 */
package com.ammann.kpi.model;

import java.util.Map;

/**
 * Distinct active actor counts split by whether the contribution's locale matched a filter.
 *
 * @param matching    per-month counts for contributions whose locale matched
 * @param nonMatching per-month counts for all other contributions
 */
public record LocalePartition(Map<Period, Long> matching, Map<Period, Long> nonMatching) {}
