package org.rapidrelief.engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import org.rapidrelief.engine.domain.exception.ConfigurationException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable weights and thresholds of the allocation engine.
 * Loaded once at startup from {@code allocation-config.yaml}.
 */
public final class AllocationConfig {

    private static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    // Soft scoring weights
    public static final String WEIGHT_SUCCESS_RATE = "weight_success_rate";
    public static final String WEIGHT_RESPONSE_TIME = "weight_response_time";
    public static final String WEIGHT_COVERAGE_RATE = "weight_coverage_rate";
    public static final String WEIGHT_RISK = "weight_risk";
    public static final String WEIGHT_REDUNDANCY = "weight_redundancy";

    // Capacity thresholds
    public static final String COVERAGE_THRESHOLD = "coverage_threshold";
    public static final String MIN_CAPACITY_COVERAGE = "min_capacity_coverage";

    // Optimizer selection and budget
    public static final String MULTI_OBJECTIVE_CANDIDATE_THRESHOLD = "multi_objective_candidate_threshold";
    public static final String LARGE_INSTANCE_CANDIDATE_THRESHOLD = "large_instance_candidate_threshold";
    public static final String OPTIMIZER_TIMEOUT_SECONDS_SMALL = "optimizer_timeout_seconds_small";
    public static final String OPTIMIZER_TIMEOUT_SECONDS_LARGE = "optimizer_timeout_seconds_large";
    public static final String NSGA_POPULATION_SIZE = "nsga_population_size";
    public static final String NSGA_GENERATIONS = "nsga_generations";
    public static final String NSGA_CROSSOVER_RATE = "nsga_crossover_rate";
    public static final String NSGA_MUTATION_RATE = "nsga_mutation_rate";
    public static final String NSGA_SEED = "nsga_seed";
    public static final String MAX_SOLUTIONS = "max_solutions";

    // Scoring scales
    public static final String PROXIMITY_SCALE_MINUTES = "proximity_scale_minutes";
    public static final String RESPONSE_TIME_HORIZON_MINUTES = "response_time_horizon_minutes";
    public static final String GREEDY_REDUNDANCY_BACKUPS = "greedy_redundancy_backups";

    public static final String CAPACITY_COEFFICIENT_PREFIX = "capacity_coefficient_";
    public static final String CAPACITY_COEFFICIENT_DEFAULT = CAPACITY_COEFFICIENT_PREFIX + "default";

    private final Map<String, Double> values;

    private AllocationConfig(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    /**
     * Creates a configuration from key-value pairs layered over {@link #defaults()},
     * then validates it.
     *
     * @throws ConfigurationException if weights do not sum to 1 or a value is out of range
     */
    public static AllocationConfig fromMap(Map<String, Double> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<String, Double> merged = new HashMap<>(defaults().values);
        for (Map.Entry<String, Double> entry : overrides.entrySet()) {
            merged.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
        }
        AllocationConfig config = new AllocationConfig(merged);
        config.validate();
        return config;
    }

    /**
     * Reads a flat YAML mapping of numeric values.
     */
    public static AllocationConfig fromDocument(JsonNode root) {
        Objects.requireNonNull(root, "root must not be null");
        if (!root.isObject()) {
            throw new ConfigurationException("Allocation configuration must be a mapping");
        }
        Map<String, Double> values = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new ConfigurationException("Allocation configuration value '" + field.getKey()
                        + "' must be numeric but was: " + field.getValue());
            }
            values.put(field.getKey(), field.getValue().asDouble());
        }
        return fromMap(values);
    }

    /**
     * Creates the default configuration.
     */
    public static AllocationConfig defaults() {
        Map<String, Double> defaults = new HashMap<>();
        defaults.put(WEIGHT_SUCCESS_RATE, 0.35);
        defaults.put(WEIGHT_RESPONSE_TIME, 0.30);
        defaults.put(WEIGHT_COVERAGE_RATE, 0.20);
        defaults.put(WEIGHT_RISK, 0.05);
        defaults.put(WEIGHT_REDUNDANCY, 0.10);
        defaults.put(COVERAGE_THRESHOLD, 0.8);
        defaults.put(MIN_CAPACITY_COVERAGE, 0.5);
        defaults.put(MULTI_OBJECTIVE_CANDIDATE_THRESHOLD, 10.0);
        defaults.put(LARGE_INSTANCE_CANDIDATE_THRESHOLD, 40.0);
        defaults.put(OPTIMIZER_TIMEOUT_SECONDS_SMALL, 10.0);
        defaults.put(OPTIMIZER_TIMEOUT_SECONDS_LARGE, 60.0);
        defaults.put(NSGA_POPULATION_SIZE, 60.0);
        defaults.put(NSGA_GENERATIONS, 80.0);
        defaults.put(NSGA_CROSSOVER_RATE, 0.9);
        defaults.put(NSGA_MUTATION_RATE, 0.0);
        defaults.put(NSGA_SEED, 42.0);
        defaults.put(MAX_SOLUTIONS, 5.0);
        defaults.put(PROXIMITY_SCALE_MINUTES, 60.0);
        defaults.put(RESPONSE_TIME_HORIZON_MINUTES, 120.0);
        defaults.put(GREEDY_REDUNDANCY_BACKUPS, 0.0);
        defaults.put(CAPACITY_COEFFICIENT_PREFIX + "medical", 5.0);
        defaults.put(CAPACITY_COEFFICIENT_PREFIX + "fire_rescue", 2.0);
        defaults.put(CAPACITY_COEFFICIENT_PREFIX + "structural", 2.0);
        defaults.put(CAPACITY_COEFFICIENT_PREFIX + "search_rescue", 1.5);
        defaults.put(CAPACITY_COEFFICIENT_PREFIX + "hazmat", 0.5);
        defaults.put(CAPACITY_COEFFICIENT_PREFIX + "engineering", 0.0);
        defaults.put(CAPACITY_COEFFICIENT_PREFIX + "volunteer", 1.0);
        defaults.put(CAPACITY_COEFFICIENT_DEFAULT, 1.0);
        return new AllocationConfig(defaults);
    }

    private void validate() {
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isNaN() || entry.getValue() < 0.0) {
                throw new ConfigurationException("Configuration value '" + entry.getKey()
                        + "' must be a non-negative number");
            }
        }
        double sum = getSuccessRateWeight() + getResponseTimeWeight() + getCoverageRateWeight()
                + getRiskWeight() + getRedundancyWeight();
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new ConfigurationException(String.format("Soft scoring weights must sum to 1.0 but sum to %.6f", sum));
        }
        requireFraction(COVERAGE_THRESHOLD);
        requireFraction(MIN_CAPACITY_COVERAGE);
        requireFraction(NSGA_CROSSOVER_RATE);
        requireFraction(NSGA_MUTATION_RATE);
        if (getNsgaPopulationSize() < 4) {
            throw new ConfigurationException("nsga_population_size must be at least 4");
        }
        if (getMaxSolutions() < 1) {
            throw new ConfigurationException("max_solutions must be at least 1");
        }
        if (getProximityScaleMinutes() <= 0.0 || getResponseTimeHorizonMinutes() <= 0.0) {
            throw new ConfigurationException("Time scales must be positive");
        }
    }

    private void requireFraction(String key) {
        double value = get(key);
        if (value > 1.0) {
            throw new ConfigurationException("Configuration value '" + key + "' must be within [0, 1]");
        }
    }

    /**
     * Gets a configuration value by key.
     */
    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown config key: " + key);
        }
        return value;
    }

    /**
     * Gets a configuration value by key, with a default.
     */
    public double getOrDefault(String key, double defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public Map<String, Double> asMap() {
        return values;
    }

    // Soft weights
    public double getSuccessRateWeight() {
        return get(WEIGHT_SUCCESS_RATE);
    }

    public double getResponseTimeWeight() {
        return get(WEIGHT_RESPONSE_TIME);
    }

    public double getCoverageRateWeight() {
        return get(WEIGHT_COVERAGE_RATE);
    }

    public double getRiskWeight() {
        return get(WEIGHT_RISK);
    }

    public double getRedundancyWeight() {
        return get(WEIGHT_REDUNDANCY);
    }

    // Thresholds
    public double getCoverageThreshold() {
        return get(COVERAGE_THRESHOLD);
    }

    public double getMinCapacityCoverage() {
        return get(MIN_CAPACITY_COVERAGE);
    }

    public int getMultiObjectiveCandidateThreshold() {
        return (int) get(MULTI_OBJECTIVE_CANDIDATE_THRESHOLD);
    }

    public int getLargeInstanceCandidateThreshold() {
        return (int) get(LARGE_INSTANCE_CANDIDATE_THRESHOLD);
    }

    public long getOptimizerTimeoutSecondsSmall() {
        return (long) get(OPTIMIZER_TIMEOUT_SECONDS_SMALL);
    }

    public long getOptimizerTimeoutSecondsLarge() {
        return (long) get(OPTIMIZER_TIMEOUT_SECONDS_LARGE);
    }

    // NSGA-II
    public int getNsgaPopulationSize() {
        return (int) get(NSGA_POPULATION_SIZE);
    }

    public int getNsgaGenerations() {
        return (int) get(NSGA_GENERATIONS);
    }

    public double getNsgaCrossoverRate() {
        return get(NSGA_CROSSOVER_RATE);
    }

    /**
     * Per-bit mutation probability; 0 means {@code 1 / candidateCount}.
     */
    public double getNsgaMutationRate() {
        return get(NSGA_MUTATION_RATE);
    }

    public long getNsgaSeed() {
        return (long) get(NSGA_SEED);
    }

    public int getMaxSolutions() {
        return (int) get(MAX_SOLUTIONS);
    }

    // Scales
    public double getProximityScaleMinutes() {
        return get(PROXIMITY_SCALE_MINUTES);
    }

    public double getResponseTimeHorizonMinutes() {
        return get(RESPONSE_TIME_HORIZON_MINUTES);
    }

    public int getGreedyRedundancyBackups() {
        return (int) get(GREEDY_REDUNDANCY_BACKUPS);
    }

    /**
     * Rescue capacity per available person for a resource type, falling back to the default coefficient.
     */
    public double getCapacityCoefficient(String resourceType) {
        if (resourceType != null) {
            Double value = values.get(CAPACITY_COEFFICIENT_PREFIX + resourceType.trim().toLowerCase(Locale.ROOT));
            if (value != null) {
                return value;
            }
        }
        return get(CAPACITY_COEFFICIENT_DEFAULT);
    }

    @Override
    public String toString() {
        return "AllocationConfig" + values;
    }
}
