package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.config.AllocationConfig;
import org.rapidrelief.engine.domain.model.ResourceCandidate;
import org.rapidrelief.engine.domain.model.ScoredCandidate;

import java.util.Set;

/**
 * Service for calculating match scores of candidate resources.
 */
public interface ScoringService {

    /**
     * Score a candidate against the required capabilities.
     * Higher score = better candidate; resources that cannot be allocated score 0.
     *
     * @param candidate the candidate to score
     * @param requiredCapabilities capabilities the run needs
     * @param config the allocation configuration
     * @return scored candidate with computed score
     */
    ScoredCandidate score(ResourceCandidate candidate, Set<String> requiredCapabilities, AllocationConfig config);
}
