package com.whereq.netpilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * Declarative description of the devices a job applies to.
 * Either explicit device identifiers, filter criteria, or both (filters then narrow the explicit set).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetSpec implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Explicit device identifiers
     */
    private List<Long> deviceIds;

    private String site;

    private String role;

    private String vendor;

    private String platform;

    /**
     * Only match enabled devices
     */
    @Builder.Default
    private boolean enabledOnly = true;

    @JsonIgnore
    public boolean isExplicit() {
        return deviceIds != null && !deviceIds.isEmpty();
    }

    /**
     * Check whether a device record satisfies the filter criteria (explicit ids are not checked here)
     */
    public boolean matches(DeviceRecord device) {
        if (enabledOnly && !device.isEnabled()) {
            return false;
        }
        return matchesField(site, device.getSite())
            && matchesField(role, device.getRole())
            && matchesField(vendor, device.getVendor())
            && matchesField(platform, device.getPlatform());
    }

    private static boolean matchesField(String expected, String actual) {
        return expected == null || expected.isBlank() || expected.equalsIgnoreCase(actual);
    }
}
