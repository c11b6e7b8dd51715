package com.whereq.netpilot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inventory entry as returned by the inventory service
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceRecord {
    private long id;
    private String tenantId;
    private String hostname;
    private String mgmtAddress;
    private String vendor;
    private String platform;
    private String site;
    private String role;

    @Builder.Default
    private boolean enabled = true;
}
