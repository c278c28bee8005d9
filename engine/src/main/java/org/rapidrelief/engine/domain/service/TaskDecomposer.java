package org.rapidrelief.engine.domain.service;

import org.rapidrelief.engine.domain.model.DecompositionResult;
import org.rapidrelief.engine.domain.model.Requirement;

import java.util.List;

/**
 * Expands required task types into an ordered, dependency-respecting task sequence.
 */
public interface TaskDecomposer {

    /**
     * Builds the task graph for the given scenes and requirements and sorts it topologically.
     *
     * @throws org.rapidrelief.engine.domain.exception.CyclicDependencyException if the merged graph has a cycle
     * @throws org.rapidrelief.engine.domain.exception.InvalidParallelGroupException if a declared
     *         parallel group contains dependent tasks
     */
    DecompositionResult decompose(List<Requirement> requirements, List<String> sceneCodes);
}
