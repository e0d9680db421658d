package org.nowstart.fundrank.repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.nowstart.fundrank.data.entity.FundScore;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FundScoreRepository extends JpaRepository<FundScore, FundScore.FundScoreKey> {

    Optional<FundScore> findByIdFundIdAndIdScoreDate(String fundId, LocalDate scoreDate);

    List<FundScore> findByIdScoreDate(LocalDate scoreDate);

    List<FundScore> findByIdScoreDateAndCategoryAndSubcategory(LocalDate scoreDate, String category, String subcategory);

    List<FundScore> findByIdScoreDateAndCategoryAndSubcategoryIsNull(LocalDate scoreDate, String category);

    Optional<FundScore> findFirstByOrderByIdScoreDateDesc();
}
