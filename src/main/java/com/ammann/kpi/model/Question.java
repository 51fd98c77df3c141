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
 * Support forum question. Read-only from the point of view of the KPI reports.
 */
@Entity
@Table(name = "question")
public class Question extends PanacheEntity
{
    @Column(name = "creator_id", nullable = false)
    @NotNull
    public Long creatorId;

    @Column(nullable = false)
    @NotNull
    public LocalDateTime created;

    /**
     * Answer marked as the solution, if any.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "solution_id")
    public Answer solution;

    /**
     * Questions asked since {@code since}, grouped by year and month.
     *
     * @param since       first day to include
     * @param solvedOnly  only count questions that have a solution
     * @return rows of {@code [year, month, count]}
     */
    public static List<Object[]> monthlyCounts(LocalDate since, boolean solvedOnly)
    {
        String query = "SELECT year(q.created), month(q.created), count(q)"
                + " FROM Question q"
                + " WHERE q.created >= :since"
                + (solvedOnly ? " AND q.solution IS NOT NULL" : "")
                + " GROUP BY year(q.created), month(q.created)";

        return getEntityManager()
                .createQuery(query, Object[].class)
                .setParameter("since", since.atStartOfDay())
                .getResultList();
    }

    /**
     * Creation time of each answered question asked since {@code since} together with the
     * creation time of its earliest answer.
     *
     * @return rows of {@code [questionCreated, firstAnswerCreated]}
     */
    public static List<Object[]> firstAnswerTimes(LocalDate since)
    {
        return getEntityManager()
                .createQuery("""
                        SELECT q.created, min(a.created)
                        FROM Answer a JOIN a.question q
                        WHERE q.created >= :since
                        GROUP BY q.id, q.created
                        """, Object[].class)
                .setParameter("since", since.atStartOfDay())
                .getResultList();
    }
}
