package org.nowstart.fundrank.data.entity;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.nowstart.fundrank.data.type.ScoreComponent;

class AuditableEntityTest {

    @Test
    void getterSetter_roundTrip() {
        ModelPortfolio entity = ModelPortfolio.builder().name("Balanced").riskProfile("MODERATE").build();
        Instant createdAt = Instant.parse("2026-01-01T00:00:00Z");
        Instant updatedAt = Instant.parse("2026-01-02T00:00:00Z");

        entity.setCreatedAt(createdAt);
        entity.setUpdatedAt(updatedAt);

        assertThat(entity.getCreatedAt()).isEqualTo(createdAt);
        assertThat(entity.getUpdatedAt()).isEqualTo(updatedAt);
    }

    @Test
    void fundScoreBuilder_startsWithEmptyComponentMap() {
        FundScore score = FundScore.builder()
                .id(new FundScore.FundScoreKey("F1", LocalDate.of(2024, 6, 28)))
                .build();

        score.getComponents().put(ScoreComponent.SHARPE, new BigDecimal("8.0000"));

        assertThat(score.getComponents()).containsEntry(ScoreComponent.SHARPE, new BigDecimal("8.0000"));
    }
}
