package org.nowstart.fundrank.service.source;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.nowstart.fundrank.data.dto.FundAttributes;
import org.nowstart.fundrank.data.dto.PeerGroupKey;
import org.nowstart.fundrank.data.entity.Fund;
import org.nowstart.fundrank.repository.FundRepository;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JpaFundAttributesReader implements FundAttributesReader {

    private final FundRepository fundRepository;

    @Override
    public Optional<FundAttributes> readFundAttributes(String fundId) {
        if (fundId == null || fundId.isBlank()) {
            return Optional.empty();
        }
        return fundRepository.findById(fundId.trim()).map(JpaFundAttributesReader::toAttributes);
    }

    @Override
    public List<FundAttributes> readActiveFunds() {
        return fundRepository.findByActiveTrueOrderByFundIdAsc().stream()
                .map(JpaFundAttributesReader::toAttributes)
                .toList();
    }

    @Override
    public List<FundAttributes> readPeerGroupMembers(PeerGroupKey peerGroup) {
        List<Fund> funds = peerGroup.subcategory() == null
                ? fundRepository.findByCategoryAndSubcategoryIsNullAndActiveTrueOrderByFundIdAsc(peerGroup.category())
                : fundRepository.findByCategoryAndSubcategoryAndActiveTrueOrderByFundIdAsc(
                        peerGroup.category(),
                        peerGroup.subcategory()
                );
        return funds.stream()
                .map(JpaFundAttributesReader::toAttributes)
                .toList();
    }

    static FundAttributes toAttributes(Fund fund) {
        return new FundAttributes(
                fund.getFundId(),
                fund.getName(),
                fund.getCategory(),
                fund.getSubcategory(),
                toDouble(fund.getExpenseRatio()),
                fund.getInceptionDate(),
                toDouble(fund.getMinimumInvestment()),
                toDouble(fund.getExitLoad()),
                toDouble(fund.getAumCrores()),
                fund.getBenchmarkName()
        );
    }

    private static Double toDouble(BigDecimal value) {
        return value == null ? null : value.doubleValue();
    }
}
