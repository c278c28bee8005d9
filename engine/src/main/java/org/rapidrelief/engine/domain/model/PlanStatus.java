package org.rapidrelief.engine.domain.model;

/**
 * Outcome of a pipeline run.
 */
public enum PlanStatus {
    /** The top-ranked solution was locked and committed. */
    COMMITTED,
    /** Every solution was vetoed by a hard rule. */
    NO_FEASIBLE_SOLUTION,
    /** No trigger rule matched the event, so nothing was required. */
    NO_MATCHING_RULES,
    /** A reviewer rejected the plan or did not answer in time. */
    REJECTED_BY_REVIEW
}
