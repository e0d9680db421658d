package org.nowstart.fundrank.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Fund extends AuditableEntity {

    @Id
    private String fundId;

    private String name;

    private String category;

    private String subcategory;

    @Column(precision = 10, scale = 4)
    private BigDecimal expenseRatio;

    private LocalDate inceptionDate;

    @Column(precision = 38, scale = 2)
    private BigDecimal minimumInvestment;

    @Column(precision = 10, scale = 4)
    private BigDecimal exitLoad;

    @Column(precision = 38, scale = 2)
    private BigDecimal aumCrores;

    private String benchmarkName;

    private boolean active;
}
