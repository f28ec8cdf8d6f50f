package com.z254.sipo.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Incident representing a group of correlated alerts.
 * <p>
 * Built once per correlation run and never modified afterwards.
 */
@Value
@Builder
public class Incident {

    /** Sequential id in group-emission order, starting at 1 */
    int incidentId;

    /** Number of member alerts */
    int alertCount;

    /** Member alerts in source order */
    @Singular
    List<AlertRecord> alerts;

    Priority priority;

    /** Sum of member customer impact */
    long totalCustomers;

    /** Sum of member revenue risk */
    long totalRevenueRisk;

    /** Error code of the first member alert */
    String primaryError;

    /** Distinct device ids in first-occurrence order */
    @Singular
    List<String> affectedDevices;
}
