package org.nowstart.fundrank.data.dto;

import java.time.LocalDate;
import java.util.List;

public record BatchScoringSummary(
        LocalDate scoreDate,
        int requested,
        int succeeded,
        int insufficientData,
        List<FundFailure> failures,
        int completedBatches,
        int rankedGroups,
        boolean cancelled
) {

    public BatchScoringSummary {
        failures = List.copyOf(failures);
    }

    public int failed() {
        return failures.size();
    }
}
