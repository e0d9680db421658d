package org.nowstart.fundrank.data.type;

import java.time.LocalDate;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RebalancePeriod {
    NONE(0),
    MONTHLY(1),
    QUARTERLY(3),
    ANNUALLY(12);

    private final int months;

    public boolean rebalances() {
        return months > 0;
    }

    public LocalDate boundary(LocalDate start, int index) {
        return start.plusMonths((long) months * index);
    }
}
