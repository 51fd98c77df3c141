/* (C)2026 */
package com.ammann.kpi.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class ReportCacheServiceTest {

    @Inject ReportCacheService cacheService;

    @BeforeEach
    void clearCache() {
        cacheService.invalidateAll();
    }

    @Test
    void secondCallWithSameKeyIsServedFromCache() {
        AtomicInteger computations = new AtomicInteger();

        List<String> first =
                cacheService.getCachedList(
                        "test:a", () -> List.of("computed-" + computations.incrementAndGet()));
        List<String> second =
                cacheService.getCachedList(
                        "test:a", () -> List.of("computed-" + computations.incrementAndGet()));

        assertThat(first).containsExactly("computed-1");
        assertThat(second).containsExactly("computed-1");
        assertThat(computations).hasValue(1);
    }

    @Test
    void invalidateAllForcesRecomputation() {
        AtomicInteger computations = new AtomicInteger();

        cacheService.getCachedList("test:b", () -> List.of(computations.incrementAndGet()));
        cacheService.invalidateAll();
        List<Integer> after =
                cacheService.getCachedList("test:b", () -> List.of(computations.incrementAndGet()));

        assertThat(after).containsExactly(2);
    }

    @Test
    void generateCacheKeySkipsNullValues() {
        assertThat(ReportCacheService.generateCacheKey("solution")).isEqualTo("solution");
        assertThat(
                        ReportCacheService.generateCacheKey(
                                "clickthrough", "engine", "sphinx", "minStart", null))
                .isEqualTo("clickthrough:engine=sphinx");
        assertThat(
                        ReportCacheService.generateCacheKey(
                                "clickthrough", "engine", "sphinx", "minStart", "2021-01-04"))
                .isEqualTo("clickthrough:engine=sphinx:minStart=2021-01-04");
    }
}
