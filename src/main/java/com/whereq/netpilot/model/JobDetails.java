package com.whereq.netpilot.model;

import lombok.Value;

import java.util.List;

/**
 * A job together with its device results, ordered by device identifier
 */
@Value
public class JobDetails {
    Job job;
    List<DeviceResult> results;
}
