package org.nowstart.fundrank.data.dto;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public record FundAttributes(
        String fundId,
        String name,
        String category,
        String subcategory,
        Double expenseRatio,
        LocalDate inceptionDate,
        Double minimumInvestment,
        Double exitLoad,
        Double aumCrores,
        String benchmarkName
) {

    public boolean hasPeerGroup() {
        return category != null && !category.isBlank();
    }

    public PeerGroupKey peerGroup() {
        return PeerGroupKey.of(category, subcategory);
    }

    public Double ageYears(LocalDate asOf) {
        if (inceptionDate == null || asOf == null || inceptionDate.isAfter(asOf)) {
            return null;
        }
        return ChronoUnit.DAYS.between(inceptionDate, asOf) / 365.25;
    }
}
