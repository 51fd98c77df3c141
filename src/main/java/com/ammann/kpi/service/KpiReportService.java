package com.ammann.kpi.service;

import com.ammann.kpi.enumeration.ActivitySource;
import com.ammann.kpi.enumeration.CountSource;
import com.ammann.kpi.model.LocalePartition;
import com.ammann.kpi.model.MergedRecord;
import com.ammann.kpi.model.NamedCount;
import com.ammann.kpi.model.Period;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the monthly KPI reports.
 *
 * <p>Each report loads one or more monthly series since the start of the report window
 * and merges them with {@link SeriesMergeEngine}. The window starts on the first day of the
 * month {@code kpi.report.lookback-days} before today.
 */
@ApplicationScoped
public class KpiReportService
{
    private static final Logger LOG = Logger.getLogger(KpiReportService.class);

    public static final String SOLVED = "solved";
    public static final String QUESTIONS = "questions";
    public static final String RESPONDED = "responded";
    public static final String KB_VOTES = "kb_votes";
    public static final String KB_HELPFUL = "kb_helpful";
    public static final String ANS_VOTES = "ans_votes";
    public static final String ANS_HELPFUL = "ans_helpful";
    public static final String EN_US = "en_us";
    public static final String NON_EN_US = "non_en_us";
    public static final String CONTRIBUTORS = "contributors";

    @Inject GroupedCountProvider groupedCountProvider;

    @Inject ActivityEventProvider activityEventProvider;

    @Inject SeriesMergeEngine mergeEngine;

    @Inject ActivityAggregator activityAggregator;

    @Inject Clock clock;

    @ConfigProperty(name = "kpi.report.lookback-days", defaultValue = "365")
    int lookbackDays;

    @ConfigProperty(name = "kpi.active-answerers.threshold", defaultValue = "10")
    int activeAnswererThreshold;

    @ConfigProperty(name = "kpi.active-contributors.locale", defaultValue = "en-US")
    String contributorLocale;

    /**
     * Questions asked and questions solved per month.
     */
    public List<MergedRecord> solutions()
    {
        LocalDate since = windowStart();
        Map<String, List<NamedCount>> series = new LinkedHashMap<>();
        series.put(SOLVED, groupedCountProvider.groupedCounts(CountSource.SOLVED_QUESTIONS, since));
        series.put(QUESTIONS, groupedCountProvider.groupedCounts(CountSource.QUESTIONS, since));
        return merge("solution", since, series);
    }

    /**
     * Total and helpful votes on articles and answers per month.
     */
    public List<MergedRecord> votes()
    {
        LocalDate since = windowStart();
        Map<String, List<NamedCount>> series = new LinkedHashMap<>();
        series.put(KB_VOTES, groupedCountProvider.groupedCounts(CountSource.KB_VOTES, since));
        series.put(KB_HELPFUL, groupedCountProvider.groupedCounts(CountSource.KB_HELPFUL_VOTES, since));
        series.put(ANS_VOTES, groupedCountProvider.groupedCounts(CountSource.ANSWER_VOTES, since));
        series.put(ANS_HELPFUL, groupedCountProvider.groupedCounts(CountSource.ANSWER_HELPFUL_VOTES, since));
        return merge("vote", since, series);
    }

    /**
     * Questions asked and questions answered within the fast-response window per month.
     */
    public List<MergedRecord> fastResponses()
    {
        LocalDate since = windowStart();
        Map<String, List<NamedCount>> series = new LinkedHashMap<>();
        series.put(RESPONDED, groupedCountProvider.groupedCounts(CountSource.RESPONDED_QUESTIONS, since));
        series.put(QUESTIONS, groupedCountProvider.groupedCounts(CountSource.QUESTIONS, since));
        return merge("fast-response", since, series);
    }

    /**
     * Distinct revision creators and reviewers per month, split into the configured locale
     * and all others.
     */
    public List<MergedRecord> activeKbContributors()
    {
        LocalDate since = windowStart();
        LocalePartition partition = activityAggregator.distinctActive(
                activityEventProvider.activityEvents(ActivitySource.KB_REVISIONS, since),
                1,
                contributorLocale::equals);

        Map<String, List<NamedCount>> series = new LinkedHashMap<>();
        series.put(EN_US, toNamedCounts(partition.matching()));
        series.put(NON_EN_US, toNamedCounts(partition.nonMatching()));
        return merge("active-kb-contributors", since, series);
    }

    /**
     * Users with at least {@code kpi.active-answerers.threshold} answers per month.
     */
    public List<MergedRecord> activeAnswerers()
    {
        LocalDate since = windowStart();
        Map<Period, Long> active = activityAggregator.distinctActive(
                activityEventProvider.activityEvents(ActivitySource.FORUM_ANSWERS, since),
                activeAnswererThreshold);

        return merge("active-answerers", since, Map.of(CONTRIBUTORS, toNamedCounts(active)));
    }

    LocalDate windowStart()
    {
        return ReportWindow.startDate(clock, lookbackDays);
    }

    private List<MergedRecord> merge(String report, LocalDate since, Map<String, List<NamedCount>> series)
    {
        List<MergedRecord> records = mergeEngine.merge(series);
        LOG.infof("Report %s: %d months since %s", report, records.size(), since);
        return records;
    }

    private static List<NamedCount> toNamedCounts(Map<Period, Long> counts)
    {
        return counts.entrySet().stream()
                .map(e -> new NamedCount(e.getKey(), e.getValue()))
                .toList();
    }
}
