package com.ammann.kpi.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * "Was this article helpful?" vote on a knowledge base revision.
 */
@Entity
@Table(name = "helpful_vote")
public class HelpfulVote extends PanacheEntity
{
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "revision_id")
    public Revision revision;

    @Column(nullable = false)
    public boolean helpful;

    @Column(nullable = false)
    @NotNull
    public LocalDateTime created;

    /**
     * @return rows of {@code [year, month, count]}
     */
    public static List<Object[]> monthlyCounts(LocalDate since, boolean helpfulOnly)
    {
        String query = "SELECT year(v.created), month(v.created), count(v)"
                + " FROM HelpfulVote v"
                + " WHERE v.created >= :since"
                + (helpfulOnly ? " AND v.helpful = true" : "")
                + " GROUP BY year(v.created), month(v.created)";

        return getEntityManager()
                .createQuery(query, Object[].class)
                .setParameter("since", since.atStartOfDay())
                .getResultList();
    }
}
