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
 * Reply to a support forum {@link Question}.
 */
@Entity
@Table(name = "answer")
public class Answer extends PanacheEntity
{
    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "question_id", nullable = false)
    @NotNull
    public Question question;

    @Column(name = "creator_id")
    public Long creatorId;

    @Column(nullable = false)
    @NotNull
    public LocalDateTime created;

    /**
     * One row per answer written since {@code since}.
     *
     * @return rows of {@code [year, month, creatorId]}
     */
    public static List<Object[]> monthlyCreators(LocalDate since)
    {
        return getEntityManager()
                .createQuery("""
                        SELECT year(a.created), month(a.created), a.creatorId
                        FROM Answer a
                        WHERE a.created >= :since
                        """, Object[].class)
                .setParameter("since", since.atStartOfDay())
                .getResultList();
    }
}
