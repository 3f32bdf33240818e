package com.travelmesh.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes decision records to the {@code travelmesh.audit} logger as key=value lines so they can
 * be routed to a separate appender. Allowed calls log at INFO, everything else at WARN.
 */
public final class Slf4jDecisionAuditLog implements DecisionAuditLog {

    public static final String LOGGER_NAME = "travelmesh.audit";

    private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void record(DecisionRecord record) {
        if (record.outcome() == EnforcementOutcome.ALLOWED) {
            log.info("decision ts={} caller={} target={} path={} outcome={} reason=\"{}\"",
                    record.timestamp(), record.caller(), record.target(), record.path(),
                    record.outcome(), record.reason());
        } else {
            log.warn("decision ts={} caller={} target={} path={} outcome={} reason=\"{}\"",
                    record.timestamp(), record.caller(), record.target(), record.path(),
                    record.outcome(), record.reason());
        }
    }
}
