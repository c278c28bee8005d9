package org.rapidrelief.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Input of one optimizer call: requirements, a candidate snapshot with resolved
 * capacities, and the number of affected people.
 */
public final class AllocationProblem {

    private final List<Requirement> requirements;
    private final List<ResourceCandidate> candidates;
    private final Map<String, ResourceCandidate> candidatesById;
    private final Set<String> requiredCapabilities;
    private final Set<String> criticalCapabilities;
    private final int estimatedAffected;

    public AllocationProblem(List<Requirement> requirements, List<ResourceCandidate> candidates,
                             int estimatedAffected) {
        Objects.requireNonNull(requirements, "requirements must not be null");
        Objects.requireNonNull(candidates, "candidates must not be null");
        if (estimatedAffected < 0) {
            throw new IllegalArgumentException("estimatedAffected must not be negative");
        }
        Map<String, ResourceCandidate> byId = new LinkedHashMap<>();
        for (ResourceCandidate candidate : candidates) {
            if (!candidate.hasRescueCapacity()) {
                throw new IllegalArgumentException("Rescue capacity of " + candidate.getId()
                        + " must be resolved before allocation");
            }
            byId.putIfAbsent(candidate.getId(), candidate);
        }
        Set<String> required = new LinkedHashSet<>();
        Set<String> critical = new LinkedHashSet<>();
        for (Requirement requirement : requirements) {
            required.addAll(requirement.getRequiredCapabilities());
            if (requirement.isCritical()) {
                critical.addAll(requirement.getRequiredCapabilities());
            }
        }
        this.requirements = Collections.unmodifiableList(new ArrayList<>(requirements));
        this.candidates = Collections.unmodifiableList(new ArrayList<>(byId.values()));
        this.candidatesById = Collections.unmodifiableMap(byId);
        this.requiredCapabilities = Collections.unmodifiableSet(required);
        this.criticalCapabilities = Collections.unmodifiableSet(critical);
        this.estimatedAffected = estimatedAffected;
    }

    public List<Requirement> getRequirements() {
        return requirements;
    }

    /**
     * Distinct candidates in catalog order.
     */
    public List<ResourceCandidate> getCandidates() {
        return candidates;
    }

    public Optional<ResourceCandidate> findCandidate(String id) {
        return Optional.ofNullable(candidatesById.get(id));
    }

    public Set<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }

    /**
     * Capabilities of critical requirements.
     */
    public Set<String> getCriticalCapabilities() {
        return criticalCapabilities;
    }

    public int getEstimatedAffected() {
        return estimatedAffected;
    }

    /**
     * Candidates whose status allows allocation.
     */
    public List<ResourceCandidate> getAllocatableCandidates() {
        List<ResourceCandidate> allocatable = new ArrayList<>();
        for (ResourceCandidate candidate : candidates) {
            if (candidate.isAllocatable()) {
                allocatable.add(candidate);
            }
        }
        return allocatable;
    }
}
