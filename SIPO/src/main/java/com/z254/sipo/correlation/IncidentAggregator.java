package com.z254.sipo.correlation;

import com.z254.sipo.domain.model.AlertRecord;
import com.z254.sipo.domain.model.Incident;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds each alert group into an {@link Incident}.
 */
@Component
public class IncidentAggregator {

    private final PriorityClassifier priorityClassifier;

    public IncidentAggregator(PriorityClassifier priorityClassifier) {
        this.priorityClassifier = priorityClassifier;
    }

    /**
     * Aggregate all groups, numbering incidents from 1 in group order.
     */
    public List<Incident> aggregateAll(List<List<AlertRecord>> groups) {
        List<Incident> incidents = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            incidents.add(aggregate(i + 1, groups.get(i)));
        }
        return incidents;
    }

    /**
     * Aggregate one group.
     *
     * @param incidentId id to assign
     * @param group member alerts in source order
     * @throws IllegalStateException if the group is empty; groupers never emit one
     * @throws ArithmeticException if a total does not fit in a long
     */
    public Incident aggregate(int incidentId, List<AlertRecord> group) {
        if (group == null || group.isEmpty()) {
            throw new IllegalStateException("Alert group for incident " + incidentId
                    + " is empty; the grouper produced an invalid partition");
        }

        long totalCustomers = 0;
        long totalRevenueRisk = 0;
        Set<String> devices = new LinkedHashSet<>();
        for (AlertRecord alert : group) {
            totalCustomers = Math.addExact(totalCustomers, alert.getCustomerImpact());
            totalRevenueRisk = Math.addExact(totalRevenueRisk, alert.getRevenueRisk());
            devices.add(alert.getDeviceId());
        }

        return Incident.builder()
                .incidentId(incidentId)
                .alertCount(group.size())
                .alerts(group)
                .priority(priorityClassifier.classify(totalRevenueRisk))
                .totalCustomers(totalCustomers)
                .totalRevenueRisk(totalRevenueRisk)
                .primaryError(group.get(0).getErrorCode())
                .affectedDevices(devices)
                .build();
    }
}
