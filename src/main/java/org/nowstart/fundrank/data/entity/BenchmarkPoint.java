package org.nowstart.fundrank.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
public class BenchmarkPoint extends AuditableEntity {

    @EmbeddedId
    private BenchmarkPointKey id;

    @Column(precision = 38, scale = 12, nullable = false)
    private BigDecimal indexValue;

    @Embeddable
    public record BenchmarkPointKey(String benchmarkName, LocalDate pointDate) implements Serializable {}
}
