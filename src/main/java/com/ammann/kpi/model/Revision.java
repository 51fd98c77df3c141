package com.ammann.kpi.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Knowledge base article revision.
 */
@Entity
@Table(name = "revision")
public class Revision extends PanacheEntity
{
    @Column(name = "creator_id")
    public Long creatorId;

    /**
     * Reviewer, {@code null} until the revision has been reviewed.
     */
    @Column(name = "reviewer_id")
    public Long reviewerId;

    /**
     * Locale of the document the revision belongs to.
     */
    @Column(length = 16, nullable = false)
    @NotNull
    public String locale;

    @Column(nullable = false)
    @NotNull
    public LocalDateTime created;

    /**
     * One row per revision created since {@code since}.
     *
     * @return rows of {@code [year, month, creatorId, reviewerId, locale]}
     */
    public static List<Object[]> monthlyContributors(LocalDate since)
    {
        return getEntityManager()
                .createQuery("""
                        SELECT year(r.created), month(r.created), r.creatorId, r.reviewerId, r.locale
                        FROM Revision r
                        WHERE r.created >= :since
                        """, Object[].class)
                .setParameter("since", since.atStartOfDay())
                .getResultList();
    }
}
