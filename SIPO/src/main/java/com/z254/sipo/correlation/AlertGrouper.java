package com.z254.sipo.correlation;

import com.z254.sipo.domain.model.AlertRecord;

import java.util.List;

/**
 * Partitions an ordered alert sequence into incident candidates.
 * <p>
 * Implementations must return non-empty groups that together contain every
 * input alert exactly once, each group keeping source order.
 */
public interface AlertGrouper {

    /**
     * Split the alerts into groups, one per future incident.
     *
     * @param alerts ordered alerts, never null
     * @return groups in emission order; empty when there are no alerts
     */
    List<List<AlertRecord>> group(List<AlertRecord> alerts);
}
