package org.nowstart.fundrank.repository;

import org.nowstart.fundrank.data.entity.ModelPortfolio;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ModelPortfolioRepository extends JpaRepository<ModelPortfolio, Long> {
}
