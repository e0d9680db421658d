package org.nowstart.fundrank.data.dto;

import java.time.LocalDate;

public record NavObservation(
        LocalDate date,
        double value
) {

    public boolean isValid() {
        return date != null && Double.isFinite(value) && value > 0.0;
    }
}
