/* (C)2026 */
package com.ammann.kpi.dto;

import com.ammann.kpi.model.MergedRecord;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One month of a KPI report.
 *
 * <p>Serialized flat, with one property per series next to the date, e.g.
 * {@code {"date":"2021-02-01","votes":0,"helpful":5}}.
 *
 * @param date first day of the month
 * @param counts series name to count
 */
@Schema(description = "Monthly KPI counts, one property per series")
public record KpiRecordDTO(
        @JsonProperty("date") @Schema(description = "First day of the month") LocalDate date,
        @JsonIgnore Map<String, Long> counts) {

    @JsonAnyGetter
    public Map<String, Long> seriesCounts() {
        return counts;
    }

    public static KpiRecordDTO from(MergedRecord record) {
        return new KpiRecordDTO(record.date(), record.counts());
    }
}
