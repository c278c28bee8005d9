package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.FilterResult;
import org.rapidrelief.engine.domain.model.ScoredSolution;

import java.util.List;

/**
 * Hard-rule filtering and soft-rule ranking of allocation solutions.
 */
public interface ConstraintFilter {

    /**
     * Evaluates every hard rule against every solution. A single rejecting rule removes the
     * solution; its reasons are kept. Warning rules attach violations to surviving solutions.
     *
     * @param solutions candidate solutions
     * @param goldenHourDeadlineMinutes deadline of the task sequence, or null when none applies
     * @return accepted and rejected solutions
     */
    FilterResult filter(List<AllocationSolution> solutions, Integer goldenHourDeadlineMinutes);

    /**
     * Weighted soft scoring of feasible solutions.
     *
     * @return solutions ranked best first; ties go to lower risk, then solution id
     */
    List<ScoredSolution> score(List<AllocationSolution> solutions);
}
