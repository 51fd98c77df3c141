/* (C)2026 */
package com.ammann.kpi.startup;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.kpi.model.MetricKind;
import io.quarkus.test.TestTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.util.List;
import org.junit.jupiter.api.Test;

@QuarkusTest
class MetricKindSeederTest {

    @Inject MetricKindSeeder seeder;

    @Test
    @TestTransaction
    void configuredEnginesAreSeededOnStartup() {
        assertThat(MetricKind.findByCode("search clickthroughs:sphinx:clicks")).isPresent();
        assertThat(MetricKind.findByCode("search clickthroughs:sphinx:searches")).isPresent();
        assertThat(MetricKind.findByCode("search clickthroughs:elastic:clicks")).isPresent();
        assertThat(MetricKind.findByCode("search clickthroughs:elastic:searches")).isPresent();
    }

    @Test
    @TestTransaction
    void seedCreatesOnlyMissingKinds() {
        assertThat(seeder.seed(List.of("sphinx"))).isZero();
        assertThat(seeder.seed(List.of("sphinx", "google"))).isEqualTo(2);
        assertThat(MetricKind.findByCode("search clickthroughs:google:clicks")).isPresent();
    }
}
