package org.rapidrelief.engine.domain.model;

/**
 * Strategy used by the allocation optimizer.
 */
public enum OptimizationMode {
    GREEDY,
    MULTI_OBJECTIVE
}
