/* (C)2026 */
package com.ammann.kpi.service;

import io.quarkus.cache.CacheInvalidateAll;
import io.quarkus.cache.CacheKey;
import io.quarkus.cache.CacheResult;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Caches computed report lists for the duration configured on the {@value #CACHE_NAME} cache.
 *
 * <p>Backed by Caffeine through quarkus-cache; the TTL is set with
 * {@code quarkus.cache.caffeine."kpi-reports".expire-after-write}.
 */
@ApplicationScoped
public class ReportCacheService {

    public static final String CACHE_NAME = "kpi-reports";

    private static final Logger LOG = Logger.getLogger(ReportCacheService.class);

    /**
     * Returns the cached list for {@code cacheKey}, computing it with {@code reportSupplier}
     * on a miss.
     *
     * @param cacheKey Unique key based on report name and request parameters
     * @param reportSupplier Supplier that computes the report
     * @return Cached or freshly computed report
     */
    @CacheResult(cacheName = CACHE_NAME)
    public <T> List<T> getCachedList(@CacheKey String cacheKey, Supplier<List<T>> reportSupplier) {
        LOG.debugf("Cache miss for key: %s, computing report", cacheKey);
        return reportSupplier.get();
    }

    /**
     * Drops every cached report, e.g. after new metric facts were written.
     */
    @CacheInvalidateAll(cacheName = CACHE_NAME)
    public void invalidateAll() {
        LOG.debug("Invalidated all cached reports");
    }

    /**
     * Generate cache key from report name and request parameters.
     *
     * <p>Format: "report:param1=value1:param2=value2:..." Parameters with a {@code null}
     * value are left out.</p>
     *
     * @param report The report being cached
     * @param params Key-value pairs of request parameters (alternating key, value)
     * @return A unique cache key string
     */
    public static String generateCacheKey(String report, Object... params) {
        StringBuilder key = new StringBuilder(report);
        for (int i = 0; i < params.length; i += 2) {
            if (i + 1 < params.length && params[i + 1] != null) {
                key.append(":").append(params[i]).append("=").append(params[i + 1]);
            }
        }
        return key.toString();
    }
}
