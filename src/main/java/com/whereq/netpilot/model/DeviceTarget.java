package com.whereq.netpilot.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Resolved device reference, produced fresh for every job
 */
@Value
@Builder
@Jacksonized
public class DeviceTarget {
    long deviceId;
    String hostname;
    String mgmtAddress;
    String vendor;
    String platform;
    String site;

    public static DeviceTarget from(DeviceRecord record) {
        return DeviceTarget.builder()
            .deviceId(record.getId())
            .hostname(record.getHostname())
            .mgmtAddress(record.getMgmtAddress())
            .vendor(record.getVendor())
            .platform(record.getPlatform())
            .site(record.getSite())
            .build();
    }
}
