/* (C)2026 */
package com.ammann.kpi.model;

/**
 * A single contribution by a user, reduced to what the activity aggregation needs.
 *
 * @param period  month of the contribution
 * @param actorId user id, or {@code null} when there is no such user (e.g. no reviewer yet)
 * @param locale  locale of the contributed content, may be {@code null}
 */
public record ActorEvent(Period period, Long actorId, String locale) {

    public static ActorEvent of(int year, int month, Long actorId) {
        return new ActorEvent(new Period(year, month), actorId, null);
    }

    public static ActorEvent of(int year, int month, Long actorId, String locale) {
        return new ActorEvent(new Period(year, month), actorId, locale);
    }
}
