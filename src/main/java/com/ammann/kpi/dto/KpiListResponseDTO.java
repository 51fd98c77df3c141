/* (C)2026 */
package com.ammann.kpi.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * List envelope for report responses.
 *
 * @param <T> The type of the listed objects
 */
public record KpiListResponseDTO<T>(
        @JsonProperty("objects") List<T> objects, @JsonProperty("total") int total) {

    public static <T> KpiListResponseDTO<T> of(List<T> objects) {
        return new KpiListResponseDTO<>(objects, objects.size());
    }
}
