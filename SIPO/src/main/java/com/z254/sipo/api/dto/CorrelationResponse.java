package com.z254.sipo.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.z254.sipo.domain.model.IncidentSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for correlated incidents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CorrelationResponse {
    private String message;
    private List<IncidentDto> incidents;
    private IncidentSummary summary;
    private String error;
}
