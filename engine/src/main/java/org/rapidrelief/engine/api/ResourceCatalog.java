package org.rapidrelief.engine.api;

import org.rapidrelief.engine.domain.model.Area;
import org.rapidrelief.engine.domain.model.ResourceCandidate;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * External store of rescue resources.
 * Every failure surfaces as {@link org.rapidrelief.engine.domain.exception.ResourceCatalogException};
 * an empty list always means "no match".
 */
public interface ResourceCatalog {

    /**
     * Candidates providing at least one of the capabilities within the area.
     * GET /v1/resources/candidates
     *
     * @param capabilities capability codes to match
     * @param area search area
     * @param maxResults result cap chosen by the caller
     * @return candidate snapshot, possibly with unknown rescue capacities
     */
    List<ResourceCandidate> query(Set<String> capabilities, Area area, int maxResults);

    /**
     * Current state of specific resources, used to revalidate a selection before commit.
     * GET /v1/resources?ids=
     */
    List<ResourceCandidate> findByIds(Collection<String> ids);

    /**
     * Marks the resources of a committed solution as no longer available.
     * POST /v1/allocations
     */
    void markCommitted(String runId, String solutionId, List<String> resourceIds);
}
