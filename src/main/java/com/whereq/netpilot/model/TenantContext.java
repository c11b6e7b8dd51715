package com.whereq.netpilot.model;

import lombok.Value;

/**
 * Caller identity and tenant carried by every request into the engine
 */
@Value
public class TenantContext {
    String tenantId;
    String userId;

    public static TenantContext of(String tenantId, String userId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant identifier is required");
        }
        return new TenantContext(tenantId, userId == null || userId.isBlank() ? "anonymous" : userId);
    }
}
