package com.ammann.kpi.health;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LivenessCheckTest
{

    @Test
    @DisplayName("Liveness check always reports UP")
    void reportsUp()
    {
        HealthCheckResponse response = new LivenessCheck().call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getName()).isEqualTo("alive");
    }
}
