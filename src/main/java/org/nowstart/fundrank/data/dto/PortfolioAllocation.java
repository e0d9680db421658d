package org.nowstart.fundrank.data.dto;

import java.math.BigDecimal;
import java.util.List;

public record PortfolioAllocation(
        String name,
        List<AllocationWeight> weights
) {

    public PortfolioAllocation {
        weights = weights == null ? List.of() : List.copyOf(weights);
    }

    public BigDecimal totalWeight() {
        return weights.stream()
                .map(AllocationWeight::weight)
                .filter(weight -> weight != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
