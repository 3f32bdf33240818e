package com.travelmesh.security;

/**
 * Sink for {@link DecisionRecord}s. Implementations must not throw.
 */
public interface DecisionAuditLog {

    void record(DecisionRecord record);
}
