package com.z254.sipo.correlation;

import com.z254.sipo.domain.model.Incident;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders incidents by revenue risk, highest first.
 * <p>
 * The sort is stable, so incidents with equal risk keep their emission order.
 * Incident ids are left untouched.
 */
@Component
public class IncidentRanker {

    private static final Comparator<Incident> BY_REVENUE_RISK_DESC =
            Comparator.comparingLong(Incident::getTotalRevenueRisk).reversed();

    public List<Incident> rank(List<Incident> incidents) {
        List<Incident> ranked = new ArrayList<>(incidents);
        ranked.sort(BY_REVENUE_RISK_DESC);
        return List.copyOf(ranked);
    }
}
