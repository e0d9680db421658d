package org.nowstart.fundrank.repository;

import java.util.List;
import org.nowstart.fundrank.data.entity.ModelPortfolioAllocation;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ModelPortfolioAllocationRepository extends JpaRepository<ModelPortfolioAllocation, Long> {

    List<ModelPortfolioAllocation> findByPortfolioIdOrderByFundIdAsc(Long portfolioId);
}
