package com.ammann.kpi.service;

import com.ammann.kpi.enumeration.ActivitySource;
import com.ammann.kpi.model.ActorEvent;
import com.ammann.kpi.model.Answer;
import com.ammann.kpi.model.Period;
import com.ammann.kpi.model.Revision;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ActivityEventProvider} reading revisions and answers.
 *
 * <p>A revision yields two events, one for its creator and one for its reviewer; the
 * reviewer event has a {@code null} actor until the revision is reviewed.
 */
@ApplicationScoped
public class PanacheActivityEventProvider implements ActivityEventProvider
{
    private static final Logger LOG = Logger.getLogger(PanacheActivityEventProvider.class);

    @Override
    public List<ActorEvent> activityEvents(ActivitySource source, LocalDate since)
    {
        List<ActorEvent> events = switch (source) {
            case KB_REVISIONS -> revisionEvents(since);
            case FORUM_ANSWERS -> answerEvents(since);
        };

        LOG.debugf("Loaded %d %s events since %s", events.size(), source, since);
        return events;
    }

    private static List<ActorEvent> revisionEvents(LocalDate since)
    {
        List<Object[]> rows = Revision.monthlyContributors(since);
        List<ActorEvent> events = new ArrayList<>(rows.size() * 2);

        for (Object[] row : rows) {
            Period period = new Period(((Number) row[0]).intValue(), ((Number) row[1]).intValue());
            String locale = (String) row[4];
            events.add(new ActorEvent(period, (Long) row[2], locale));
            events.add(new ActorEvent(period, (Long) row[3], locale));
        }
        return events;
    }

    private static List<ActorEvent> answerEvents(LocalDate since)
    {
        return Answer.monthlyCreators(since).stream()
                .map(row -> new ActorEvent(
                        new Period(((Number) row[0]).intValue(), ((Number) row[1]).intValue()),
                        (Long) row[2],
                        null))
                .toList();
    }
}
