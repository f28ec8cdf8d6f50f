package com.z254.sipo.domain.model;

import lombok.Value;

import java.util.List;

/**
 * Output of one correlation run: ranked incidents plus their summary.
 */
@Value
public class CorrelationResult {

    List<Incident> incidents;

    IncidentSummary summary;

    public int getIncidentCount() {
        return incidents.size();
    }
}
