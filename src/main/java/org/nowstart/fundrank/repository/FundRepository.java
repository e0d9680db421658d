package org.nowstart.fundrank.repository;

import java.util.List;
import org.nowstart.fundrank.data.entity.Fund;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FundRepository extends JpaRepository<Fund, String> {

    List<Fund> findByActiveTrueOrderByFundIdAsc();

    List<Fund> findByCategoryAndSubcategoryAndActiveTrueOrderByFundIdAsc(String category, String subcategory);

    List<Fund> findByCategoryAndSubcategoryIsNullAndActiveTrueOrderByFundIdAsc(String category);
}
