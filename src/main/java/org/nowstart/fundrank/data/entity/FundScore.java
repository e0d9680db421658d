package org.nowstart.fundrank.data.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.MapKeyEnumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.fundrank.data.type.Recommendation;
import org.nowstart.fundrank.data.type.ScoreComponent;
import org.nowstart.fundrank.data.type.DataStatus;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FundScore extends AuditableEntity {

    @EmbeddedId
    private FundScoreKey id;

    private String category;

    private String subcategory;

    @Column(precision = 10, scale = 4)
    private BigDecimal returnsTotal;

    @Column(precision = 10, scale = 4)
    private BigDecimal riskTotal;

    @Column(precision = 10, scale = 4)
    private BigDecimal fundamentalsTotal;

    @Column(precision = 10, scale = 4)
    private BigDecimal otherTotal;

    @Column(precision = 10, scale = 4)
    private BigDecimal total;

    @Enumerated(EnumType.STRING)
    private DataStatus status;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "fund_score_component")
    @MapKeyEnumerated(EnumType.STRING)
    @MapKeyColumn(name = "component")
    @Column(name = "points", precision = 10, scale = 4)
    private Map<ScoreComponent, BigDecimal> components = new EnumMap<>(ScoreComponent.class);

    private Integer peerRank;

    private Integer quartile;

    @Column(precision = 10, scale = 4)
    private BigDecimal percentile;

    private Integer peerGroupSize;

    @Enumerated(EnumType.STRING)
    private Recommendation recommendation;

    @Embeddable
    public record FundScoreKey(String fundId, LocalDate scoreDate) implements Serializable {}
}
