package com.z254.sipo.correlation;

import com.z254.sipo.config.SipoProperties;
import com.z254.sipo.domain.model.AlertRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional grouper that cuts the alert sequence into contiguous chunks.
 * <p>
 * The chunk size is {@code ceil(N / target)} so that roughly {@code target}
 * incidents come out whatever the input volume; the last chunk takes the
 * remainder. Alert content plays no part in the grouping.
 */
@Slf4j
@Component
public class FixedCountAlertGrouper implements AlertGrouper {

    private final int targetGroupCount;

    public FixedCountAlertGrouper(SipoProperties properties) {
        this.targetGroupCount = properties.getCorrelation().getTargetIncidentCount();
        if (targetGroupCount <= 0) {
            throw new IllegalArgumentException("targetIncidentCount must be positive: " + targetGroupCount);
        }
    }

    @Override
    public List<List<AlertRecord>> group(List<AlertRecord> alerts) {
        int total = alerts.size();
        if (total == 0) {
            return List.of();
        }

        int groupSize = groupSize(total);
        List<List<AlertRecord>> groups = new ArrayList<>((total + groupSize - 1) / groupSize);
        for (int start = 0; start < total; start += groupSize) {
            int end = Math.min(start + groupSize, total);
            groups.add(List.copyOf(alerts.subList(start, end)));
        }

        log.debug("Grouped {} alerts into {} groups of up to {}", total, groups.size(), groupSize);
        return groups;
    }

    /**
     * Chunk size for the given alert count, {@code ceil(total / target)}.
     */
    public int groupSize(int total) {
        return (total + targetGroupCount - 1) / targetGroupCount;
    }
}
