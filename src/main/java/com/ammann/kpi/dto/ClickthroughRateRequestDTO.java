/* (C)2026 */
package com.ammann.kpi.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Posted weekly clickthrough observation.
 *
 * <p>Values are kept as sent so that the write path can reject non-numeric input with a
 * validation error instead of a deserialization failure.
 *
 * @param start first day of the week, e.g. {@code 2021-01-04}
 * @param clicks number of searches with at least one clicked result
 * @param searches number of searches performed
 */
@Schema(description = "One week of search clickthrough counts")
public record ClickthroughRateRequestDTO(
        @Schema(description = "First day of the week (YYYY-MM-DD)", example = "2021-01-04")
                String start,
        @Schema(description = "Searches with a clicked result", implementation = Long.class)
                Object clicks,
        @Schema(description = "Searches performed", implementation = Long.class)
                Object searches) {}
