package com.ammann.kpi.health;

import com.ammann.kpi.model.Metric;
import com.ammann.kpi.model.MetricKind;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.time.Duration;
import java.time.Instant;

/**
 * Readiness health check that verifies database connectivity through the metric fact tables.
 *
 * <p>Reports DOWN if the count queries fail or take longer than 1 second.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    static final String NAME = "database-health";

    @Override
    @ActivateRequestContext
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();

            long metricKinds = MetricKind.count();
            long metricFacts = Metric.count();

            Duration queryTime = Duration.between(start, Instant.now());
            boolean performanceOk = queryTime.toMillis() < 1000; // < 1 second

            return HealthCheckResponse.named(NAME)
                    .status(performanceOk)
                    .withData("metric-kinds", metricKinds)
                    .withData("metric-facts", metricFacts)
                    .withData("query-time-ms", queryTime.toMillis())
                    .withData("performance-ok", performanceOk)
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("database-accessible", false)
                    .build();
        }
    }
}
