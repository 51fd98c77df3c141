package com.ammann.kpi.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;

import java.util.Optional;

/**
 * Namespace tag of a metric fact series, e.g. {@code search clickthroughs:sphinx:clicks}.
 */
@Entity
@Table(name = MetricKind.TABLE_NAME)
public class MetricKind extends PanacheEntity
{
    public static final String TABLE_NAME = "kpi_metrickind";

    @Column(nullable = false, unique = true)
    @NotBlank
    public String code;

    public MetricKind()
    {
    }

    public MetricKind(String code)
    {
        this.code = code;
    }

    public static Optional<MetricKind> findByCode(String code)
    {
        return find("code", code).firstResultOptional();
    }
}
