package com.ammann.kpi.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * A single observed value of some metric kind over the bucket {@code [start, end)}.
 *
 * <p>Rows are written once and never updated.
 */
@Entity
@Table(name = Metric.TABLE_NAME, indexes = {
        @Index(name = "idx_metric_kind_start", columnList = "kind_id, start_date")
})
public class Metric extends PanacheEntity
{
    public static final String TABLE_NAME = "kpi_metric";

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "kind_id", nullable = false)
    @NotNull
    public MetricKind kind;

    /**
     * First day of the bucket, inclusive.
     */
    @Column(name = "start_date", nullable = false)
    @NotNull
    public LocalDate start;

    /**
     * Day after the bucket, exclusive.
     */
    @Column(name = "end_date", nullable = false)
    @NotNull
    public LocalDate end;

    @Column(name = "metric_value", nullable = false)
    @Min(value = 0, message = "Metric value must be non-negative")
    public long value;

    public Metric()
    {
    }

    public Metric(MetricKind kind, LocalDate start, LocalDate end, long value)
    {
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.value = value;
    }

    /**
     * Facts of the given kind, oldest first, optionally limited to those starting on or after
     * {@code minStart}.
     */
    public static List<Metric> findByKind(String kindCode, Optional<LocalDate> minStart)
    {
        Sort byStart = Sort.by("start").and("id");
        if (minStart.isPresent()) {
            return list("kind.code = ?1 and start >= ?2", byStart, kindCode, minStart.get());
        }
        return list("kind.code = ?1", byStart, kindCode);
    }
}
