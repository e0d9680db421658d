package org.nowstart.fundrank.service.backtest;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.nowstart.fundrank.data.dto.AllocationWeight;
import org.nowstart.fundrank.data.dto.BacktestRequest;
import org.nowstart.fundrank.data.exception.InvalidInputException;
import org.nowstart.fundrank.data.property.BacktestProperties;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BacktestRequestValidationService {

    private final BacktestProperties backtestProperties;

    public void validate(BacktestRequest request) {
        if (request == null || request.allocation() == null || request.allocation().weights().isEmpty()) {
            throw new InvalidInputException(InvalidInputException.INVALID_ALLOCATION, "Allocation must contain at least one fund");
        }

        Set<String> fundIds = new HashSet<>();
        for (AllocationWeight weight : request.allocation().weights()) {
            if (weight == null || weight.fundId() == null || weight.fundId().isBlank()) {
                throw new InvalidInputException(InvalidInputException.INVALID_ALLOCATION, "Allocation fund id is required");
            }
            if (weight.weight() == null || weight.weight().compareTo(BigDecimal.ZERO) <= 0) {
                throw new InvalidInputException(
                        InvalidInputException.INVALID_ALLOCATION,
                        "Allocation weight must be greater than zero: " + weight.fundId()
                );
            }
            if (!fundIds.add(weight.fundId())) {
                throw new InvalidInputException(
                        InvalidInputException.INVALID_ALLOCATION,
                        "Duplicate fund in allocation: " + weight.fundId()
                );
            }
        }

        BigDecimal totalWeight = request.allocation().totalWeight();
        BigDecimal tolerance = BigDecimal.valueOf(backtestProperties.weightTolerance());
        if (totalWeight.subtract(BigDecimal.ONE).abs().compareTo(tolerance) > 0) {
            throw new InvalidInputException(
                    InvalidInputException.INVALID_ALLOCATION,
                    "Allocation weights must sum to 1.0 (±" + tolerance.toPlainString() + "), got " + totalWeight.toPlainString()
            );
        }

        if (request.startDate() == null || request.endDate() == null || !request.startDate().isBefore(request.endDate())) {
            throw new InvalidInputException(InvalidInputException.INVALID_DATE_RANGE, "Start date must be before end date");
        }

        if (request.initialAmount() == null || request.initialAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new InvalidInputException(InvalidInputException.INVALID_AMOUNT, "Initial amount must be greater than zero");
        }
    }
}
