package org.rapidrelief.engine.domain.exception;

import java.util.Collections;
import java.util.List;

/**
 * The merged task graph contains a cycle; no execution order exists.
 */
public final class CyclicDependencyException extends AllocationException {

    private final List<String> unresolvedTasks;

    public CyclicDependencyException(List<String> unresolvedTasks) {
        super("CYCLIC_DEPENDENCY", "Task dependencies contain a cycle among: " + unresolvedTasks);
        this.unresolvedTasks = Collections.unmodifiableList(unresolvedTasks);
    }

    public List<String> getUnresolvedTasks() {
        return unresolvedTasks;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
