package org.rapidrelief.engine.domain.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A feasible solution with its weighted soft score.
 * Natural order is ranking order: higher score first, then lower risk, then solution id.
 */
public final class ScoredSolution implements Comparable<ScoredSolution> {

    public static final String SUCCESS_RATE = "success_rate";
    public static final String RESPONSE_TIME = "response_time";
    public static final String COVERAGE_RATE = "coverage_rate";
    public static final String RISK = "risk";
    public static final String REDUNDANCY = "redundancy";

    private static final Comparator<ScoredSolution> RANKING = Comparator
            .comparingDouble(ScoredSolution::getTotalScore).reversed()
            .thenComparingDouble(s -> s.getSolution().getObjectiveValues().getRisk())
            .thenComparing(s -> s.getSolution().getSolutionId());

    private final AllocationSolution solution;
    private final double totalScore;
    private final Map<String, Double> dimensionScores;

    public ScoredSolution(AllocationSolution solution, double totalScore, Map<String, Double> dimensionScores) {
        this.solution = Objects.requireNonNull(solution, "solution must not be null");
        Objects.requireNonNull(dimensionScores, "dimensionScores must not be null");
        this.totalScore = totalScore;
        this.dimensionScores = Collections.unmodifiableMap(new LinkedHashMap<>(dimensionScores));
    }

    public AllocationSolution getSolution() {
        return solution;
    }

    public double getTotalScore() {
        return totalScore;
    }

    public Map<String, Double> getDimensionScores() {
        return dimensionScores;
    }

    public boolean requiresHumanReview() {
        return solution.requiresHumanReview();
    }

    @Override
    public int compareTo(ScoredSolution other) {
        return RANKING.compare(this, other);
    }

    @Override
    public String toString() {
        return String.format("ScoredSolution{%s, score=%.4f, dimensions=%s}",
                solution.getSolutionId(), totalScore, dimensionScores);
    }
}
