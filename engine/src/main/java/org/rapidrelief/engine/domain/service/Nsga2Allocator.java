package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.exception.AllocationCancelledException;
import org.rapidrelief.engine.domain.exception.OptimizerNonConvergenceException;
import org.rapidrelief.engine.domain.exception.OptimizerTimeoutException;
import org.rapidrelief.engine.domain.model.AllocationProblem;
import org.rapidrelief.engine.domain.model.AllocationSolution;
import org.rapidrelief.engine.domain.model.ResourceCandidate;
import org.rapidrelief.engine.domain.model.Violation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

/**
 * NSGA-II over subsets of the allocatable candidates.
 * <p>
 * Each individual is a bit string (one bit per candidate). Objectives, all minimised:
 * response time, negated capability coverage, negated rescue capacity, cost and risk.
 * An individual is feasible when it selects at least one resource and, when people are
 * affected, its capacity coverage reaches {@code min_capacity_coverage}. Feasible individuals
 * dominate infeasible ones; infeasible individuals are ordered by total violation.
 * <p>
 * The run is reproducible for a given {@code nsga_seed}. The deadline is checked at the
 * start of every generation.
 */
public final class Nsga2Allocator {

    private static final Logger LOG = Logger.getLogger(Nsga2Allocator.class.getName());

    public static final String STRATEGY = "nsga2";

    private static final int OBJECTIVES = 5;

    private final SolutionEvaluator evaluator;
    private final AllocationConfig config;
    private final Clock clock;

    public Nsga2Allocator(SolutionEvaluator evaluator, AllocationConfig config, Clock clock) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Runs the genetic search.
     *
     * @param problem allocation problem
     * @param seeds solutions used to seed the initial population, typically the greedy baselines
     * @param timeout wall-clock budget
     * @return feasible members of the first front, at most {@code max_solutions}
     * @throws OptimizerTimeoutException when the budget runs out with no feasible individual
     * @throws OptimizerNonConvergenceException when the generation budget ends with no feasible individual
     */
    public List<AllocationSolution> allocate(AllocationProblem problem, List<AllocationSolution> seeds,
                                             Duration timeout) {
        Objects.requireNonNull(problem, "problem must not be null");
        Objects.requireNonNull(seeds, "seeds must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        List<ResourceCandidate> candidates = problem.getAllocatableCandidates();
        if (candidates.isEmpty()) {
            throw new OptimizerNonConvergenceException("No allocatable candidates for multi-objective optimization");
        }

        Instant started = clock.instant();
        Instant deadline = started.plus(timeout);
        Encoding encoding = new Encoding(candidates, problem, config.getMinCapacityCoverage());
        Random random = new Random(config.getNsgaSeed());
        int populationSize = config.getNsgaPopulationSize();
        int generations = config.getNsgaGenerations();
        double crossoverRate = config.getNsgaCrossoverRate();
        double mutationRate = config.getNsgaMutationRate() > 0.0
                ? config.getNsgaMutationRate()
                : 1.0 / candidates.size();

        List<Individual> population = initialPopulation(encoding, seeds, populationSize, random);
        rank(population);

        int completed = 0;
        boolean timedOut = false;
        for (int generation = 0; generation < generations; generation++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AllocationCancelledException("multi-objective optimization");
            }
            if (!clock.instant().isBefore(deadline)) {
                timedOut = true;
                break;
            }
            List<Individual> offspring = new ArrayList<>(populationSize);
            while (offspring.size() < populationSize) {
                Individual first = tournament(population, random);
                Individual second = tournament(population, random);
                BitSet genes = random.nextDouble() < crossoverRate
                        ? crossover(first.genes, second.genes, encoding.size, random)
                        : (BitSet) first.genes.clone();
                mutate(genes, encoding.size, mutationRate, random);
                repair(genes, encoding.size, random);
                offspring.add(encoding.evaluate(genes));
            }
            List<Individual> combined = new ArrayList<>(population);
            combined.addAll(offspring);
            population = survivors(combined, populationSize);
            completed++;
        }

        int generationsCompleted = completed;
        boolean deadlineReached = timedOut;
        long elapsed = Duration.between(started, clock.instant()).toMillis();
        LOG.info(() -> String.format("NSGA-II finished %d/%d generations over %d candidates in %d ms%s",
                generationsCompleted, generations, encoding.size, elapsed, deadlineReached ? " (deadline reached)" : ""));

        List<Individual> front = paretoFront(population);
        if (front.isEmpty()) {
            if (timedOut) {
                throw new OptimizerTimeoutException(timeout, generationsCompleted);
            }
            throw new OptimizerNonConvergenceException(String.format(
                    "No feasible allocation after %d generations: capacity coverage of %.2f is unreachable or no resource fits",
                    generationsCompleted, config.getMinCapacityCoverage()));
        }

        List<Violation> extra = new ArrayList<>();
        if (timedOut) {
            extra.add(Violation.warning(Violation.OPTIMIZER_TIMEOUT, String.format(
                    "Multi-objective optimization stopped after %d of %d generations (timeout %ds)",
                    generationsCompleted, generations, timeout.getSeconds())));
        }

        List<AllocationSolution> solutions = new ArrayList<>();
        for (Individual individual : front) {
            if (solutions.size() >= config.getMaxSolutions()) {
                break;
            }
            AllocationSolution solution = evaluator.evaluate("nsga2-" + (solutions.size() + 1), STRATEGY,
                    encoding.decode(individual.genes), problem);
            solutions.add(solution.withAdditionalViolations(extra));
        }
        return solutions;
    }

    private static List<Individual> initialPopulation(Encoding encoding, List<AllocationSolution> seeds,
                                                      int populationSize, Random random) {
        List<Individual> population = new ArrayList<>(populationSize);
        Set<BitSet> seen = new HashSet<>();
        for (AllocationSolution seed : seeds) {
            BitSet genes = encoding.encode(seed.getSelectedResources());
            if (!genes.isEmpty() && population.size() < populationSize && seen.add(genes)) {
                population.add(encoding.evaluate(genes));
            }
        }
        BitSet everything = new BitSet(encoding.size);
        everything.set(0, encoding.size);
        if (population.size() < populationSize && seen.add(everything)) {
            population.add(encoding.evaluate(everything));
        }
        while (population.size() < populationSize) {
            double density = 0.1 + 0.8 * random.nextDouble();
            BitSet genes = new BitSet(encoding.size);
            for (int i = 0; i < encoding.size; i++) {
                if (random.nextDouble() < density) {
                    genes.set(i);
                }
            }
            repair(genes, encoding.size, random);
            population.add(encoding.evaluate(genes));
        }
        return population;
    }

    private static Individual tournament(List<Individual> population, Random random) {
        Individual a = population.get(random.nextInt(population.size()));
        Individual b = population.get(random.nextInt(population.size()));
        if (a.rank != b.rank) {
            return a.rank < b.rank ? a : b;
        }
        if (a.crowding != b.crowding) {
            return a.crowding > b.crowding ? a : b;
        }
        return random.nextBoolean() ? a : b;
    }

    private static BitSet crossover(BitSet first, BitSet second, int size, Random random) {
        BitSet child = new BitSet(size);
        for (int i = 0; i < size; i++) {
            if (random.nextBoolean() ? first.get(i) : second.get(i)) {
                child.set(i);
            }
        }
        return child;
    }

    private static void mutate(BitSet genes, int size, double rate, Random random) {
        for (int i = 0; i < size; i++) {
            if (random.nextDouble() < rate) {
                genes.flip(i);
            }
        }
    }

    private static void repair(BitSet genes, int size, Random random) {
        if (genes.isEmpty()) {
            genes.set(random.nextInt(size));
        }
    }

    private static List<Individual> survivors(List<Individual> combined, int populationSize) {
        List<List<Individual>> fronts = nonDominatedSort(combined);
        List<Individual> next = new ArrayList<>(populationSize);
        for (List<Individual> front : fronts) {
            assignCrowding(front);
            if (next.size() + front.size() <= populationSize) {
                next.addAll(front);
                continue;
            }
            List<Individual> ordered = new ArrayList<>(front);
            ordered.sort(Comparator.comparingDouble((Individual i) -> i.crowding).reversed());
            next.addAll(ordered.subList(0, populationSize - next.size()));
            break;
        }
        return next;
    }

    private static void rank(List<Individual> population) {
        for (List<Individual> front : nonDominatedSort(population)) {
            assignCrowding(front);
        }
    }

    /**
     * Fast non-dominated sort; sets {@link Individual#rank} and returns the fronts in order.
     */
    static List<List<Individual>> nonDominatedSort(List<Individual> population) {
        int n = population.size();
        List<List<Integer>> dominates = new ArrayList<>(n);
        int[] dominatedBy = new int[n];
        List<List<Individual>> fronts = new ArrayList<>();
        List<Integer> current = new ArrayList<>();

        for (int p = 0; p < n; p++) {
            dominates.add(new ArrayList<>());
        }
        for (int p = 0; p < n; p++) {
            for (int q = p + 1; q < n; q++) {
                Individual a = population.get(p);
                Individual b = population.get(q);
                if (a.dominates(b)) {
                    dominates.get(p).add(q);
                    dominatedBy[q]++;
                } else if (b.dominates(a)) {
                    dominates.get(q).add(p);
                    dominatedBy[p]++;
                }
            }
        }
        for (int p = 0; p < n; p++) {
            if (dominatedBy[p] == 0) {
                current.add(p);
            }
        }

        int rank = 0;
        while (!current.isEmpty()) {
            List<Individual> front = new ArrayList<>(current.size());
            List<Integer> next = new ArrayList<>();
            for (int p : current) {
                Individual individual = population.get(p);
                individual.rank = rank;
                front.add(individual);
                for (int q : dominates.get(p)) {
                    if (--dominatedBy[q] == 0) {
                        next.add(q);
                    }
                }
            }
            fronts.add(front);
            current = next;
            rank++;
        }
        return fronts;
    }

    static void assignCrowding(List<Individual> front) {
        for (Individual individual : front) {
            individual.crowding = 0.0;
        }
        if (front.size() <= 2) {
            front.forEach(i -> i.crowding = Double.POSITIVE_INFINITY);
            return;
        }
        List<Individual> ordered = new ArrayList<>(front);
        for (int m = 0; m < OBJECTIVES; m++) {
            int objective = m;
            ordered.sort(Comparator.comparingDouble(i -> i.objectives[objective]));
            double min = ordered.get(0).objectives[objective];
            double max = ordered.get(ordered.size() - 1).objectives[objective];
            ordered.get(0).crowding = Double.POSITIVE_INFINITY;
            ordered.get(ordered.size() - 1).crowding = Double.POSITIVE_INFINITY;
            if (max - min <= 0.0) {
                continue;
            }
            for (int k = 1; k < ordered.size() - 1; k++) {
                Individual individual = ordered.get(k);
                if (!Double.isInfinite(individual.crowding)) {
                    individual.crowding += (ordered.get(k + 1).objectives[objective]
                            - ordered.get(k - 1).objectives[objective]) / (max - min);
                }
            }
        }
    }

    /**
     * Feasible, distinct members of the first front, most isolated first.
     */
    private static List<Individual> paretoFront(List<Individual> population) {
        List<List<Individual>> fronts = nonDominatedSort(population);
        if (fronts.isEmpty()) {
            return List.of();
        }
        List<Individual> first = fronts.get(0);
        assignCrowding(first);
        Map<BitSet, Individual> distinct = new LinkedHashMap<>();
        for (Individual individual : first) {
            if (individual.isFeasible()) {
                distinct.putIfAbsent(individual.genes, individual);
            }
        }
        List<Individual> result = new ArrayList<>(distinct.values());
        result.sort(Comparator.comparingDouble((Individual i) -> i.crowding).reversed()
                .thenComparing(i -> i.genes.toString()));
        return result;
    }

    /**
     * Maps bit strings onto candidates and computes objectives without building solutions.
     */
    private static final class Encoding {

        private final int size;
        private final List<ResourceCandidate> candidates;
        private final Map<String, Integer> indexById = new HashMap<>();
        private final BitSet[] capabilityMasks;
        private final int requiredCount;
        private final int affected;
        private final double minCapacityCoverage;

        Encoding(List<ResourceCandidate> candidates, AllocationProblem problem, double minCapacityCoverage) {
            this.size = candidates.size();
            this.candidates = candidates;
            this.affected = problem.getEstimatedAffected();
            this.minCapacityCoverage = minCapacityCoverage;

            List<String> required = new ArrayList<>(problem.getRequiredCapabilities());
            this.requiredCount = required.size();
            this.capabilityMasks = new BitSet[size];
            for (int i = 0; i < size; i++) {
                ResourceCandidate candidate = candidates.get(i);
                indexById.put(candidate.getId(), i);
                BitSet mask = new BitSet(requiredCount);
                for (int c = 0; c < requiredCount; c++) {
                    if (candidate.getCapabilities().contains(required.get(c))) {
                        mask.set(c);
                    }
                }
                capabilityMasks[i] = mask;
            }
        }

        BitSet encode(List<String> ids) {
            BitSet genes = new BitSet(size);
            for (String id : ids) {
                Integer index = indexById.get(id);
                if (index != null) {
                    genes.set(index);
                }
            }
            return genes;
        }

        List<ResourceCandidate> decode(BitSet genes) {
            List<ResourceCandidate> selected = new ArrayList<>(genes.cardinality());
            for (int i = genes.nextSetBit(0); i >= 0; i = genes.nextSetBit(i + 1)) {
                selected.add(candidates.get(i));
            }
            return selected;
        }

        Individual evaluate(BitSet genes) {
            BitSet covered = new BitSet(requiredCount);
            double responseTime = 0.0;
            double cost = 0.0;
            double maxHazard = 0.0;
            int capacity = 0;
            for (int i = genes.nextSetBit(0); i >= 0; i = genes.nextSetBit(i + 1)) {
                ResourceCandidate candidate = candidates.get(i);
                covered.or(capabilityMasks[i]);
                responseTime = Math.max(responseTime, candidate.getEtaMinutes());
                cost += candidate.getDeploymentCost();
                maxHazard = Math.max(maxHazard, candidate.getHazardLevel());
                capacity += candidate.requireRescueCapacity();
            }
            double coverage = requiredCount == 0 ? 1.0 : (double) covered.cardinality() / requiredCount;
            double risk = 1.0 - coverage * (1.0 - maxHazard);

            double violation = 0.0;
            if (genes.isEmpty()) {
                violation += 1.0;
            }
            if (affected > 0) {
                violation += Math.max(0.0, minCapacityCoverage
                        - SolutionEvaluator.capacityCoverage(capacity, affected));
            }
            double[] objectives = {responseTime, -coverage, -capacity, cost, risk};
            return new Individual(genes, objectives, violation);
        }
    }

    static final class Individual {

        private final BitSet genes;
        private final double[] objectives;
        private final double violation;
        private int rank;
        private double crowding;

        Individual(BitSet genes, double[] objectives, double violation) {
            this.genes = genes;
            this.objectives = objectives;
            this.violation = violation;
        }

        boolean isFeasible() {
            return violation <= 0.0;
        }

        /**
         * Constrained domination.
         */
        boolean dominates(Individual other) {
            if (isFeasible() != other.isFeasible()) {
                return isFeasible();
            }
            if (!isFeasible()) {
                return violation < other.violation;
            }
            boolean strictlyBetter = false;
            for (int m = 0; m < objectives.length; m++) {
                if (objectives[m] > other.objectives[m]) {
                    return false;
                }
                if (objectives[m] < other.objectives[m]) {
                    strictlyBetter = true;
                }
            }
            return strictlyBetter;
        }

        @Override
        public String toString() {
            return "Individual{genes=" + genes + ", objectives=" + Arrays.toString(objectives)
                    + ", violation=" + violation + ", rank=" + rank + '}';
        }
    }
}
