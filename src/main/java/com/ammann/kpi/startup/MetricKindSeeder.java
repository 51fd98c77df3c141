/* (C)2026 */
package com.ammann.kpi.startup;

import com.ammann.kpi.model.MetricKind;
import com.ammann.kpi.service.ClickthroughService;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Registers the clickthrough metric kinds of every configured search engine on startup.
 * <p>
 * The metric store only accepts facts of known kinds, so the clicks and searches kinds of
 * each engine in {@code kpi.clickthrough.engines} must exist before the first POST arrives.
 * Existing kinds are left untouched.
 */
@ApplicationScoped
public class MetricKindSeeder {

    private static final Logger LOG = Logger.getLogger(MetricKindSeeder.class);

    @Inject ClickthroughService clickthroughService;

    @Transactional
    void onStart(@Observes StartupEvent event) {
        int created = seed(clickthroughService.engines());

        if (created > 0) {
            LOG.infof("Metric kind seeding: created %d missing kinds", created);
        } else {
            LOG.info("Metric kind seeding: all clickthrough kinds present");
        }
    }

    /**
     * Creates the clicks and searches kinds of the given engines where missing.
     *
     * @return number of kinds created
     */
    @Transactional
    public int seed(List<String> engines) {
        int created = 0;
        for (String engine : engines) {
            for (String code :
                    List.of(
                            ClickthroughService.clicksKind(engine),
                            ClickthroughService.searchesKind(engine))) {
                if (MetricKind.findByCode(code).isEmpty()) {
                    new MetricKind(code).persist();
                    LOG.debugf("Created metric kind '%s'", code);
                    created++;
                }
            }
        }
        return created;
    }
}
