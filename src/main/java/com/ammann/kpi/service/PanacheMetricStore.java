package com.ammann.kpi.service;

import com.ammann.kpi.exception.MetricStoreException;
import com.ammann.kpi.model.Metric;
import com.ammann.kpi.model.MetricKind;
import com.ammann.kpi.model.MetricObservation;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * {@link MetricStore} backed by the {@code kpi_metric} and {@code kpi_metrickind} tables.
 *
 * <p>Inserts join the caller's transaction when there is one, so a paired write made from
 * a transactional service commits or rolls back as a whole.
 */
@ApplicationScoped
public class PanacheMetricStore implements MetricStore {

    private static final Logger LOG = Logger.getLogger(PanacheMetricStore.class);

    @Override
    public List<MetricObservation> query(String kind, Optional<LocalDate> startGte) {
        return Metric.findByKind(kind, startGte).stream()
                .map(metric -> new MetricObservation(metric.start, metric.value))
                .toList();
    }

    /**
     * @throws MetricStoreException if no {@link MetricKind} with code {@code kind} exists
     */
    @Override
    @Transactional
    public void insert(String kind, LocalDate start, LocalDate end, long value) {
        MetricKind metricKind =
                MetricKind.findByCode(kind).orElseThrow(() -> MetricStoreException.unknownKind(kind));

        new Metric(metricKind, start, end, value).persist();
        LOG.debugf("Stored metric '%s' [%s, %s) = %d", kind, start, end, value);
    }
}
