package com.travelmesh.security;

/**
 * Identity metadata extracted from one inbound call by a transport adapter.
 *
 * @param presentedCaller      the {@code x-agent-id} value as received (nullable)
 * @param orchestratorOfRecord the {@code x-supervisor-id} value as received (nullable)
 * @param declaredTarget       the {@code x-target-id} value as received (nullable)
 * @param path                 request path
 */
public record InboundCall(
        String presentedCaller,
        String orchestratorOfRecord,
        String declaredTarget,
        String path
) {
}
