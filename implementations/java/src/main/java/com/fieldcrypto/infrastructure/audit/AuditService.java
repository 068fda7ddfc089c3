package com.fieldcrypto.infrastructure.audit;

/**
 * Minimal audit service for recording security-relevant events.
 * The initial implementation logs; swap for a durable sink in production.
 */
public interface AuditService {
    void record(String category, String action, String resourceId, String detail);
}
