package com.ammann.kpi.enumeration;

/**
 * Grouped event counts available to the KPI reports.
 */
public enum CountSource
{
    /** All questions asked. */
    QUESTIONS,

    /** Questions with an answer marked as the solution. */
    SOLVED_QUESTIONS,

    /** Questions that received an answer within the fast-response window. */
    RESPONDED_QUESTIONS,

    /** All knowledge base article votes. */
    KB_VOTES,

    /** Knowledge base article votes marked helpful. */
    KB_HELPFUL_VOTES,

    /** All answer votes. */
    ANSWER_VOTES,

    /** Answer votes marked helpful. */
    ANSWER_HELPFUL_VOTES
}
