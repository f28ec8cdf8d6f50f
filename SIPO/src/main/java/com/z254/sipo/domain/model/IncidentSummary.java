package com.z254.sipo.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Dashboard statistics derived from a ranked incident list.
 */
@Value
@Builder
@Jacksonized
public class IncidentSummary {

    private static final IncidentSummary EMPTY = IncidentSummary.builder()
            .priorityCounts(Map.of())
            .build();

    int totalIncidents;

    long totalAlerts;

    long totalCustomers;

    long totalRevenue;

    /** Priority label to incident count, only for labels that occur */
    Map<String, Integer> priorityCounts;

    /** Percentage of alerts folded away, one decimal place */
    double reductionRate;

    public static IncidentSummary empty() {
        return EMPTY;
    }
}
