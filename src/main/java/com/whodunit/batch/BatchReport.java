package com.whodunit.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.whodunit.contract.GameRecord;

import java.util.List;

/**
 * Result of a batch run: converged records and faults, each in seed order,
 * with proposition-count statistics over the converged games.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BatchReport(
    @JsonProperty("requested") int requested,
    @JsonProperty("records") List<GameRecord> records,
    @JsonProperty("faults") List<BatchFault> faults,
    @JsonProperty("min_propositions") int minPropositions,
    @JsonProperty("max_propositions") int maxPropositions,
    @JsonProperty("average_propositions") double averagePropositions
) {

    public BatchReport {
        records = List.copyOf(records);
        faults = List.copyOf(faults);
    }

    public static BatchReport of(int requested, List<GameRecord> records, List<BatchFault> faults) {
        int min = records.stream().mapToInt(r -> r.propositions().size()).min().orElse(0);
        int max = records.stream().mapToInt(r -> r.propositions().size()).max().orElse(0);
        double average = records.stream().mapToInt(r -> r.propositions().size()).average().orElse(0.0);
        return new BatchReport(requested, records, faults, min, max, average);
    }

    @JsonProperty("converged")
    public int converged() {
        return records.size();
    }
}
