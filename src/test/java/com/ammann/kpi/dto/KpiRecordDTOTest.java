/* (C)2026 */
package com.ammann.kpi.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.kpi.model.MergedRecord;
import com.ammann.kpi.model.RatioPoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class KpiRecordDTOTest {

    private final ObjectMapper mapper =
            new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void serializesSeriesNextToDate() throws Exception {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("votes", 0L);
        counts.put("helpful", 5L);

        String json =
                mapper.writeValueAsString(
                        KpiRecordDTO.from(new MergedRecord(LocalDate.of(2021, 2, 1), counts)));

        assertThat(json).isEqualTo("{\"date\":\"2021-02-01\",\"votes\":0,\"helpful\":5}");
    }

    @Test
    void listEnvelopeCarriesTotal() throws Exception {
        KpiListResponseDTO<ClickthroughRateDTO> envelope =
                KpiListResponseDTO.of(
                        List.of(
                                ClickthroughRateDTO.from(
                                        new RatioPoint(LocalDate.of(2021, 1, 4), 10, 100))));

        String json = mapper.writeValueAsString(envelope);

        assertThat(json)
                .isEqualTo(
                        "{\"objects\":[{\"start\":\"2021-01-04\",\"clicks\":10,\"searches\":100}],"
                                + "\"total\":1}");
    }

    @Test
    void requestAcceptsNumbersAndStrings() throws Exception {
        ClickthroughRateRequestDTO request =
                mapper.readValue(
                        "{\"start\":\"2021-01-04\",\"clicks\":\"10\",\"searches\":100}",
                        ClickthroughRateRequestDTO.class);

        assertThat(request.start()).isEqualTo("2021-01-04");
        assertThat(request.clicks()).isEqualTo("10");
        assertThat(request.searches()).isEqualTo(100);
    }
}
