package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.model.ResourceCandidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Resolves missing rescue capacities before any allocation decision.
 * <p>
 * {@code capacity = floor(available_personnel x coefficient(resource_type))}. A positive
 * personnel count never estimates to zero unless the type's coefficient is zero.
 */
public final class CapacityEstimator {

    private static final Logger LOG = Logger.getLogger(CapacityEstimator.class.getName());

    private final AllocationConfig config;

    public CapacityEstimator(AllocationConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Returns the candidates with every rescue capacity present. Supplied capacities are kept.
     */
    public List<ResourceCandidate> resolve(List<ResourceCandidate> candidates) {
        List<ResourceCandidate> resolved = new ArrayList<>(candidates.size());
        int estimated = 0;
        for (ResourceCandidate candidate : candidates) {
            if (candidate.hasRescueCapacity()) {
                resolved.add(candidate);
            } else {
                resolved.add(candidate.toBuilder()
                        .rescueCapacity(estimate(candidate))
                        .capacityEstimated(true)
                        .build());
                estimated++;
            }
        }
        if (estimated > 0) {
            final int count = estimated;
            LOG.info(() -> String.format("Estimated rescue capacity for %d of %d candidates", count, candidates.size()));
        }
        return resolved;
    }

    /**
     * Estimated capacity for one candidate from its personnel and type.
     */
    public int estimate(ResourceCandidate candidate) {
        double coefficient = config.getCapacityCoefficient(candidate.getResourceType());
        int personnel = candidate.getAvailablePersonnel();
        int capacity = (int) Math.floor(personnel * coefficient);
        if (capacity == 0 && personnel > 0 && coefficient > 0.0) {
            capacity = 1;
        }
        final int result = capacity;
        LOG.fine(() -> String.format("Capacity of %s (%s): %d personnel x %.2f = %d",
                candidate.getId(), candidate.getResourceType(), personnel, coefficient, result));
        return capacity;
    }
}
