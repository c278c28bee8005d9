package org.rapidrelief.engine.api;

/**
 * Push channel for committed plans. Delivery semantics belong to the implementation.
 */
public interface NotificationSink {

    void planCommitted(PlanCommittedEvent event);
}
