package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.OptimizationMode;
import org.rapidrelief.engine.domain.model.Priority;
import org.rapidrelief.engine.domain.model.Requirement;
import org.rapidrelief.engine.domain.model.ResourceCandidate;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.rapidrelief.engine.support.TestCandidates.requirement;
import static org.rapidrelief.engine.support.TestCandidates.team;

class AllocationOptimizerImplTest {

    private final AllocationOptimizerImpl optimizer = new AllocationOptimizerImpl(new ScoringServiceImpl(),
            smallSearch(), Clock.systemUTC());

    private final List<Requirement> requirements = List.of(
            requirement("EM10", Priority.CRITICAL, "structural_rescue"),
            requirement("EM14", Priority.HIGH, "medical_triage"));

    @Test
    void selectsModeByCandidateCount() {
        assertThat(optimizer.selectMode(10)).isEqualTo(OptimizationMode.GREEDY);
        assertThat(optimizer.selectMode(11)).isEqualTo(OptimizationMode.MULTI_OBJECTIVE);
    }

    @Test
    void largerInstancesGetTheLargerTimeBudget() {
        assertThat(optimizer.timeoutFor(40)).isEqualTo(Duration.ofSeconds(10));
        assertThat(optimizer.timeoutFor(41)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void greedyModeReturnsGreedyBaselines() {
        List<AllocationSolution> solutions = optimizer.optimize(requirements, candidates(6), 100,
                OptimizationMode.GREEDY);

        assertThat(solutions).isNotEmpty()
                .allSatisfy(s -> assertThat(s.getStrategy()).startsWith("greedy:"));
    }

    @Test
    void multiObjectiveModeReturnsParetoSolutions() {
        List<AllocationSolution> solutions = optimizer.optimize(requirements, candidates(14), 200,
                OptimizationMode.MULTI_OBJECTIVE);

        assertThat(solutions).isNotEmpty()
                .allSatisfy(s -> assertThat(s.getStrategy()).isEqualTo(Nsga2Allocator.STRATEGY));
    }

    private static List<ResourceCandidate> candidates(int count) {
        List<ResourceCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String capability = i % 2 == 0 ? "structural_rescue" : "medical_triage";
            candidates.add(team("t" + i, 20 + i, 5 + 3 * i, capability));
        }
        return candidates;
    }

    private static AllocationConfig smallSearch() {
        Map<String, Double> overrides = new HashMap<>();
        overrides.put(AllocationConfig.NSGA_POPULATION_SIZE, 16.0);
        overrides.put(AllocationConfig.NSGA_GENERATIONS, 10.0);
        return AllocationConfig.fromMap(overrides);
    }
}
