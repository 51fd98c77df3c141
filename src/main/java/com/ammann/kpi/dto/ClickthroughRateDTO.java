/* (C)2026 */
package com.ammann.kpi.dto;

import com.ammann.kpi.model.RatioPoint;
import java.time.LocalDate;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Weekly clickthrough rate of one search engine.
 *
 * @param start first day of the week
 * @param clicks searches with a clicked result
 * @param searches searches performed
 */
@Schema(description = "Clickthrough counts for one week")
public record ClickthroughRateDTO(
        @Schema(description = "First day of the week") LocalDate start,
        @Schema(description = "Searches with a clicked result") long clicks,
        @Schema(description = "Searches performed") long searches) {

    public static ClickthroughRateDTO from(RatioPoint point) {
        return new ClickthroughRateDTO(point.start(), point.numerator(), point.denominator());
    }
}
