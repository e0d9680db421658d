package org.nowstart.fundrank.data.type;

import java.time.LocalDate;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ReturnPeriod {
    MONTH_3("3M", 90, 10, false),
    MONTH_6("6M", 180, 15, false),
    YEAR_1("1Y", 365, 30, false),
    YEAR_3("3Y", 1095, 90, true),
    YEAR_5("5Y", 1825, 150, true),
    YTD("YTD", 0, 45, false);

    private final String label;
    private final int lookbackDays;
    private final int toleranceDays;
    private final boolean annualized;

    public LocalDate targetDate(LocalDate asOf) {
        if (this == YTD) {
            return LocalDate.of(asOf.getYear() - 1, 12, 31);
        }
        return asOf.minusDays(lookbackDays);
    }

    public LocalDate earliestAcceptedDate(LocalDate asOf) {
        return targetDate(asOf).minusDays(toleranceDays);
    }
}
