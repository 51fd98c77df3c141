package com.ammann.kpi.enumeration;

/**
 * Per-user contribution events used to count active contributors.
 */
public enum ActivitySource
{
    /** Knowledge base revision creators and reviewers, tagged with the document locale. */
    KB_REVISIONS,

    /** Support forum answer authors. */
    FORUM_ANSWERS
}
