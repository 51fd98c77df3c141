package com.ammann.kpi.service;

import com.ammann.kpi.model.MetricObservation;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Storage of generic {@code (kind, start, end, value)} metric facts.
 */
public interface MetricStore
{
    /**
     * Returns the facts of {@code kind}, ordered by start date ascending.
     *
     * @param kind     metric kind code
     * @param startGte when present, only facts starting on or after this date
     */
    List<MetricObservation> query(String kind, Optional<LocalDate> startGte);

    /**
     * Stores one fact.
     *
     * @throws com.ammann.kpi.exception.MetricStoreException if the fact cannot be stored
     */
    void insert(String kind, LocalDate start, LocalDate end, long value);
}
