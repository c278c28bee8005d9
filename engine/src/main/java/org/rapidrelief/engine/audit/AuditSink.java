package org.rapidrelief.engine.audit;

/**
 * Receives one record per pipeline run, failed runs included. Storage belongs to the implementation.
 */
public interface AuditSink {

    void record(PipelineRunRecord record);
}
