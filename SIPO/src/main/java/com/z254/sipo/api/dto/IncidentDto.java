package com.z254.sipo.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.z254.sipo.domain.model.AlertRecord;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.List;

/**
 * DTO for incident representation in API responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentDto {
    @JsonProperty("incident_id")
    private int incidentId;

    @JsonProperty("alert_count")
    private int alertCount;

    @JsonProperty("alerts")
    private List<AlertRecord> alerts;

    @JsonProperty("priority")
    private String priority;

    @JsonProperty("total_customers")
    private long totalCustomers;

    @JsonProperty("total_revenue_risk")
    private long totalRevenueRisk;

    @JsonProperty("primary_error")
    private String primaryError;

    @JsonProperty("affected_devices")
    private List<String> affectedDevices;
}
