package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.model.ResourceCandidate;
import org.rapidrelief.engine.domain.model.ScoredCandidate;

import java.util.Set;
import java.util.logging.Logger;

/**
 * Implementation of ScoringService.
 *
 * Score formula (higher = better):
 *   score = capability_overlap * availability_weight * proximity_weight
 *
 *   capability_overlap  = |provided ∩ required| / |required|   (1 when nothing is required)
 *   availability_weight = 1.0 available, 0.7 standby, 0 otherwise
 *   proximity_weight    = 1 / (1 + eta_minutes / proximity_scale_minutes)
 */
public final class ScoringServiceImpl implements ScoringService {

    private static final Logger LOG = Logger.getLogger(ScoringServiceImpl.class.getName());

    @Override
    public ScoredCandidate score(ResourceCandidate candidate, Set<String> requiredCapabilities,
                                 AllocationConfig config) {
        double overlap = calculateOverlap(candidate, requiredCapabilities);
        double availability = candidate.getStatus().getAvailabilityWeight();
        double proximity = calculateProximity(candidate, config);

        ScoredCandidate scored = new ScoredCandidate(candidate, overlap, availability, proximity);
        LOG.fine(() -> String.format(
                "Scored %s: overlap=%.2f, availability=%.2f, proximity=%.2f, total=%.3f",
                candidate.getId(), overlap, availability, proximity, scored.getScore()));
        return scored;
    }

    /**
     * Fraction of the required capabilities the candidate provides.
     */
    private double calculateOverlap(ResourceCandidate candidate, Set<String> requiredCapabilities) {
        if (requiredCapabilities.isEmpty()) {
            return 1.0;
        }
        long provided = requiredCapabilities.stream()
                .filter(candidate.getCapabilities()::contains)
                .count();
        return (double) provided / requiredCapabilities.size();
    }

    /**
     * Decays with travel time; halves when the ETA equals the proximity scale.
     */
    private double calculateProximity(ResourceCandidate candidate, AllocationConfig config) {
        return 1.0 / (1.0 + candidate.getEtaMinutes() / config.getProximityScaleMinutes());
    }
}
