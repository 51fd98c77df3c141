/* (C)2026 */
package com.ammann.kpi.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.kpi.exception.MetricStoreException;
import com.ammann.kpi.model.Metric;
import com.ammann.kpi.model.MetricKind;
import com.ammann.kpi.model.MetricObservation;
import io.quarkus.test.TestTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.Test;

@QuarkusTest
class PanacheMetricStoreTest {

    private static final String KIND = "test:store:value";

    @Inject PanacheMetricStore store;

    @Test
    @TestTransaction
    void insertThenQueryReturnsFactsByStartAscending() {
        new MetricKind(KIND).persist();

        store.insert(KIND, LocalDate.of(2021, 1, 11), LocalDate.of(2021, 1, 18), 20);
        store.insert(KIND, LocalDate.of(2021, 1, 4), LocalDate.of(2021, 1, 11), 10);

        assertThat(store.query(KIND, Optional.empty()))
                .containsExactly(
                        new MetricObservation(LocalDate.of(2021, 1, 4), 10),
                        new MetricObservation(LocalDate.of(2021, 1, 11), 20));

        Metric stored = Metric.findByKind(KIND, Optional.empty()).get(0);
        assertThat(stored.end).isEqualTo(LocalDate.of(2021, 1, 11));
    }

    @Test
    @TestTransaction
    void queryAppliesInclusiveMinStart() {
        new MetricKind(KIND).persist();
        store.insert(KIND, LocalDate.of(2021, 1, 4), LocalDate.of(2021, 1, 11), 10);
        store.insert(KIND, LocalDate.of(2021, 1, 11), LocalDate.of(2021, 1, 18), 20);

        assertThat(store.query(KIND, Optional.of(LocalDate.of(2021, 1, 11))))
                .extracting(MetricObservation::value)
                .containsExactly(20L);
        assertThat(store.query(KIND, Optional.of(LocalDate.of(2021, 2, 1)))).isEmpty();
    }

    @Test
    @TestTransaction
    void queryOfUnknownKindIsEmpty() {
        assertThat(store.query("test:store:missing", Optional.empty())).isEmpty();
    }

    @Test
    @TestTransaction
    void insertOfUnknownKindFails() {
        assertThatThrownBy(
                        () ->
                                store.insert(
                                        "test:store:missing",
                                        LocalDate.of(2021, 1, 4),
                                        LocalDate.of(2021, 1, 11),
                                        1))
                .isInstanceOf(MetricStoreException.class)
                .hasMessageContaining("test:store:missing");
    }
}
