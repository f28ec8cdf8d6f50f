package com.z254.sipo.correlation;

import com.z254.sipo.domain.model.AlertRecord;
import com.z254.sipo.domain.model.CorrelationResult;
import com.z254.sipo.domain.model.Incident;
import com.z254.sipo.domain.model.IncidentSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Alert correlation pipeline: grouping, aggregation, ranking and summary.
 * <p>
 * Stateless; every call works on its own copy of the input, so one instance
 * can serve concurrent requests.
 */
@Slf4j
@Component
public class AlertCorrelationEngine {

    private final AlertGrouper grouper;
    private final IncidentAggregator aggregator;
    private final IncidentRanker ranker;
    private final SummaryCalculator summaryCalculator;

    public AlertCorrelationEngine(AlertGrouper grouper,
                                  IncidentAggregator aggregator,
                                  IncidentRanker ranker,
                                  SummaryCalculator summaryCalculator) {
        this.grouper = grouper;
        this.aggregator = aggregator;
        this.ranker = ranker;
        this.summaryCalculator = summaryCalculator;
    }

    /**
     * Correlate alerts into ranked incidents and summarize them.
     *
     * @param alerts normalized alerts in source order
     * @return ranked incidents and summary; empty when there are no alerts
     */
    public CorrelationResult correlate(List<AlertRecord> alerts) {
        List<AlertRecord> input = new ArrayList<>(alerts);

        List<List<AlertRecord>> groups = grouper.group(input);
        List<Incident> ranked = ranker.rank(aggregator.aggregateAll(groups));
        IncidentSummary summary = summaryCalculator.summarize(ranked);

        log.debug("Correlated {} alerts into {} incidents (reduction {}%)",
                input.size(), ranked.size(), summary.getReductionRate());
        return new CorrelationResult(ranked, summary);
    }
}
