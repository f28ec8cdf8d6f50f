package com.z254.sipo.correlation;

import com.z254.sipo.config.SipoProperties;
import com.z254.sipo.domain.model.Priority;
import org.springframework.stereotype.Component;

/**
 * Maps aggregated revenue risk to a priority level.
 * <p>
 * Both thresholds are exclusive lower bounds: a risk equal to the high
 * threshold is still Medium, a risk equal to the medium threshold is Low.
 */
@Component
public class PriorityClassifier {

    private final long highThreshold;
    private final long mediumThreshold;

    public PriorityClassifier(SipoProperties properties) {
        this.highThreshold = properties.getPriority().getHighThreshold();
        this.mediumThreshold = properties.getPriority().getMediumThreshold();
        if (mediumThreshold > highThreshold) {
            throw new IllegalArgumentException("mediumThreshold (" + mediumThreshold
                    + ") must not exceed highThreshold (" + highThreshold + ")");
        }
    }

    public Priority classify(long totalRevenueRisk) {
        if (totalRevenueRisk > highThreshold) {
            return Priority.HIGH;
        }
        if (totalRevenueRisk > mediumThreshold) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }
}
