package com.ammann.kpi.service;

import com.ammann.kpi.dto.ClickthroughRateRequestDTO;
import com.ammann.kpi.exception.ValidationException;
import com.ammann.kpi.model.RatioPoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Search clickthrough rates per search engine.
 *
 * <p>A rate is the number of searches with a clicked result over the number of searches
 * performed, for one week. Both numbers are stored as separate metric facts of the kinds
 * {@code search clickthroughs:<engine>:clicks} and {@code search clickthroughs:<engine>:searches}.
 */
@ApplicationScoped
public class ClickthroughService
{
    private static final Logger LOG = Logger.getLogger(ClickthroughService.class);

    private static final String KIND_PREFIX = "search clickthroughs:";

    @Inject PairedMetricRatioResolver ratioResolver;

    @Inject MeterRegistry meterRegistry;

    @ConfigProperty(name = "kpi.clickthrough.engines", defaultValue = "sphinx,elastic")
    List<String> engines;

    public static String clicksKind(String engine)
    {
        return KIND_PREFIX + engine + ":clicks";
    }

    public static String searchesKind(String engine)
    {
        return KIND_PREFIX + engine + ":searches";
    }

    public boolean isKnownEngine(String engine)
    {
        return engine != null && engines.contains(engine);
    }

    public List<String> engines()
    {
        return List.copyOf(engines);
    }

    /**
     * Weekly clickthrough rates of {@code engine}, oldest first.
     *
     * @param minStart optional ISO date; ignored when malformed
     */
    public List<RatioPoint> clickthroughRates(String engine, String minStart)
    {
        return ratioResolver.resolve(clicksKind(engine), searchesKind(engine), minStart);
    }

    /**
     * Stores one week of clicks and searches for {@code engine}.
     *
     * @throws ValidationException if the request body is missing
     * @throws com.ammann.kpi.exception.InvalidInputException if a field cannot be parsed
     * @throws com.ammann.kpi.exception.StoreInconsistencyException if only the clicks were stored
     */
    @Transactional
    public void record(String engine, ClickthroughRateRequestDTO request)
    {
        if (request == null) {
            throw ValidationException.missingField("body");
        }

        try {
            ratioResolver.record(
                    clicksKind(engine), searchesKind(engine),
                    request.start(), request.clicks(), request.searches());
        } catch (RuntimeException e) {
            counter("kpi_ratio_record_failures_total", "Failed clickthrough writes", engine).increment();
            throw e;
        }

        counter("kpi_ratio_observations_recorded_total", "Stored clickthrough observations", engine)
                .increment();
        LOG.infof("Recorded %s clickthrough for week of %s: clicks=%s, searches=%s",
                engine, request.start(), request.clicks(), request.searches());
    }

    private Counter counter(String name, String description, String engine)
    {
        return Counter.builder(name)
                .description(description)
                .tag("engine", engine)
                .register(meterRegistry);
    }
}
