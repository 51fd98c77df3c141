package com.ammann.kpi.service;

import com.ammann.kpi.enumeration.CountSource;
import com.ammann.kpi.model.AnswerVote;
import com.ammann.kpi.model.HelpfulVote;
import com.ammann.kpi.model.NamedCount;
import com.ammann.kpi.model.Period;
import com.ammann.kpi.model.Question;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link GroupedCountProvider} that groups the forum and knowledge base tables by the year
 * and month of their creation time.
 */
@ApplicationScoped
public class PanacheGroupedCountProvider implements GroupedCountProvider
{
    private static final Logger LOG = Logger.getLogger(PanacheGroupedCountProvider.class);

    @ConfigProperty(name = "kpi.fast-response.window-hours", defaultValue = "72")
    long fastResponseWindowHours;

    @Override
    public List<NamedCount> groupedCounts(CountSource source, LocalDate since)
    {
        List<NamedCount> counts = switch (source) {
            case QUESTIONS -> toNamedCounts(Question.monthlyCounts(since, false));
            case SOLVED_QUESTIONS -> toNamedCounts(Question.monthlyCounts(since, true));
            case RESPONDED_QUESTIONS -> respondedQuestions(since);
            case KB_VOTES -> toNamedCounts(HelpfulVote.monthlyCounts(since, false));
            case KB_HELPFUL_VOTES -> toNamedCounts(HelpfulVote.monthlyCounts(since, true));
            case ANSWER_VOTES -> toNamedCounts(AnswerVote.monthlyCounts(since, false));
            case ANSWER_HELPFUL_VOTES -> toNamedCounts(AnswerVote.monthlyCounts(since, true));
        };

        LOG.debugf("Grouped %s since %s into %d months", source, since, counts.size());
        return counts;
    }

    /**
     * Questions whose earliest answer arrived within the fast-response window, grouped by the
     * month the question was asked.
     */
    private List<NamedCount> respondedQuestions(LocalDate since)
    {
        Duration window = Duration.ofHours(fastResponseWindowHours);
        Map<Period, Long> responded = new TreeMap<>();

        for (Object[] row : Question.firstAnswerTimes(since)) {
            LocalDateTime asked = (LocalDateTime) row[0];
            LocalDateTime firstAnswer = (LocalDateTime) row[1];
            if (firstAnswer != null && Duration.between(asked, firstAnswer).compareTo(window) < 0) {
                responded.merge(Period.from(asked.toLocalDate()), 1L, Long::sum);
            }
        }

        return responded.entrySet().stream()
                .map(e -> new NamedCount(e.getKey(), e.getValue()))
                .toList();
    }

    static List<NamedCount> toNamedCounts(List<Object[]> rows)
    {
        return rows.stream()
                .map(row -> new NamedCount(
                        new Period(((Number) row[0]).intValue(), ((Number) row[1]).intValue()),
                        ((Number) row[2]).longValue()))
                .toList();
    }
}
