package org.nowstart.fundrank.data.dto;

import java.math.BigDecimal;

public record AllocationWeight(
        String fundId,
        BigDecimal weight
) {
}
