package com.ammann.kpi.service;

import com.ammann.kpi.enumeration.ActivitySource;
import com.ammann.kpi.model.ActorEvent;

import java.time.LocalDate;
import java.util.List;

/**
 * Raw per-user contribution events of one source, for events on or after a start date.
 */
public interface ActivityEventProvider
{
    List<ActorEvent> activityEvents(ActivitySource source, LocalDate since);
}
