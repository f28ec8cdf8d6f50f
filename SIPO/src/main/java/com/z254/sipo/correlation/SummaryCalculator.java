package com.z254.sipo.correlation;

import com.z254.sipo.domain.model.Incident;
import com.z254.sipo.domain.model.IncidentSummary;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes dashboard totals over a ranked incident list.
 */
@Component
public class SummaryCalculator {

    public IncidentSummary summarize(List<Incident> incidents) {
        if (incidents.isEmpty()) {
            return IncidentSummary.empty();
        }

        long totalAlerts = 0;
        long totalCustomers = 0;
        long totalRevenue = 0;
        Map<String, Integer> priorityCounts = new LinkedHashMap<>();
        for (Incident incident : incidents) {
            totalAlerts += incident.getAlertCount();
            totalCustomers = Math.addExact(totalCustomers, incident.getTotalCustomers());
            totalRevenue = Math.addExact(totalRevenue, incident.getTotalRevenueRisk());
            priorityCounts.merge(incident.getPriority().getLabel(), 1, Integer::sum);
        }

        return IncidentSummary.builder()
                .totalIncidents(incidents.size())
                .totalAlerts(totalAlerts)
                .totalCustomers(totalCustomers)
                .totalRevenue(totalRevenue)
                .priorityCounts(Collections.unmodifiableMap(priorityCounts))
                .reductionRate(reductionRate(totalAlerts, incidents.size()))
                .build();
    }

    /**
     * Percentage of alerts absorbed into incidents, rounded half-up to one decimal.
     * Zero when there are no alerts.
     */
    static double reductionRate(long totalAlerts, long totalIncidents) {
        if (totalAlerts == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(totalAlerts - totalIncidents)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(totalAlerts), 1, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
