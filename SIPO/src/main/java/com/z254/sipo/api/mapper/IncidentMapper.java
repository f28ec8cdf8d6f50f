package com.z254.sipo.api.mapper;

import com.z254.sipo.api.dto.CorrelationResponse;
import com.z254.sipo.api.dto.IncidentDto;
import com.z254.sipo.domain.model.CorrelationResult;
import com.z254.sipo.domain.model.Incident;

/**
 * Mapper for incident to DTO conversion.
 */
public final class IncidentMapper {

    private IncidentMapper() {}

    public static IncidentDto toDto(Incident incident) {
        return IncidentDto.builder()
                .incidentId(incident.getIncidentId())
                .alertCount(incident.getAlertCount())
                .alerts(incident.getAlerts())
                .priority(incident.getPriority().getLabel())
                .totalCustomers(incident.getTotalCustomers())
                .totalRevenueRisk(incident.getTotalRevenueRisk())
                .primaryError(incident.getPrimaryError())
                .affectedDevices(incident.getAffectedDevices())
                .build();
    }

    public static CorrelationResponse toResponse(CorrelationResult result) {
        return CorrelationResponse.builder()
                .message("Correlated " + result.getSummary().getTotalAlerts() + " alerts into "
                        + result.getIncidentCount() + " incidents")
                .incidents(result.getIncidents().stream().map(IncidentMapper::toDto).toList())
                .summary(result.getSummary())
                .build();
    }
}
