package org.rapidrelief.engine.support;

import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.GeoPoint;
import org.rapidrelief.engine.domain.model.ObjectiveValues;
import org.rapidrelief.engine.domain.model.Priority;
import org.rapidrelief.engine.domain.model.Requirement;
import org.rapidrelief.engine.domain.model.ResourceCandidate;
import org.rapidrelief.engine.domain.model.ResourceStatus;
import org.rapidrelief.engine.domain.model.ScoredSolution;
import org.rapidrelief.engine.domain.model.Violation;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Builders for candidates, requirements and solutions used across tests.
 */
public final class TestCandidates {

    public static final GeoPoint SCENE = new GeoPoint(30.66, 104.06);

    private TestCandidates() {
    }

    public static ResourceCandidate team(String id, int rescueCapacity, double etaMinutes, String... capabilities) {
        return builder(id, capabilities)
                .rescueCapacity(rescueCapacity)
                .etaMinutes(etaMinutes)
                .build();
    }

    public static ResourceCandidate.Builder builder(String id, String... capabilities) {
        return new ResourceCandidate.Builder()
                .id(id)
                .name("Team " + id)
                .resourceType("search_rescue")
                .capabilities(new LinkedHashSet<>(Arrays.asList(capabilities)))
                .availablePersonnel(10)
                .location(SCENE)
                .status(ResourceStatus.AVAILABLE)
                .deploymentCost(100.0);
    }

    public static Requirement requirement(String taskType, Priority priority, String... capabilities) {
        return new Requirement(taskType, priority, new LinkedHashSet<>(Arrays.asList(capabilities)));
    }

    public static AllocationSolution solution(String solutionId, List<Violation> violations, String... resourceIds) {
        return new AllocationSolution.Builder()
                .solutionId(solutionId)
                .strategy("greedy:eta")
                .selectedResources(Arrays.asList(resourceIds))
                .totalRescueCapacity(100)
                .estimatedAffected(100)
                .capacityCoverageRate(1.0)
                .objectiveValues(new ObjectiveValues(20.0, 1.0, 100.0 * resourceIds.length, 0.02))
                .violations(violations)
                .build();
    }

    public static ScoredSolution scored(String solutionId, String... resourceIds) {
        return new ScoredSolution(solution(solutionId, Collections.emptyList(), resourceIds), 0.8,
                Collections.emptyMap());
    }
}
