package com.infomedia.abacox.feeschedule.db.entity;

import com.infomedia.abacox.feeschedule.component.feeengine.CalculationBasis;
import com.infomedia.abacox.feeschedule.db.entity.superclass.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.ColumnDefault;

import java.math.BigDecimal;

@Entity
@Table(
        name = "fee_rule",
        uniqueConstraints = @UniqueConstraint(name = "uq_fee_rule_code", columnNames = "fee_code")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class FeeRule extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "fee_rule_id_seq")
    @SequenceGenerator(
            name = "fee_rule_id_seq",
            sequenceName = "fee_rule_id_seq",
            allocationSize = 1
    )
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "fee_name", length = 100, nullable = false)
    private String feeName;

    @Column(name = "fee_code", length = 50, nullable = false)
    private String feeCode;

    /**
     * Null when the rule applies to every classification.
     */
    @Column(name = "applies_to_classification_id")
    private Long appliesToClassificationId;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", length = 3, nullable = false)
    @ColumnDefault("'USD'")
    private String currency;

    @Column(name = "is_taxable", nullable = false)
    @ColumnDefault("true")
    private Boolean taxable;

    @Column(name = "is_potentially_waivable_by_fuel_uplift", nullable = false)
    @ColumnDefault("false")
    private Boolean potentiallyWaivableByFuelUplift;

    @Column(name = "is_manually_waivable", nullable = false)
    @ColumnDefault("false")
    private Boolean manuallyWaivable;

    @Enumerated(EnumType.STRING)
    @Column(name = "calculation_basis", length = 30, nullable = false)
    @ColumnDefault("'NOT_APPLICABLE'")
    private CalculationBasis calculationBasis;

    @Column(name = "has_caa_override", nullable = false)
    @ColumnDefault("false")
    private Boolean hasCaaOverride;

    @Column(name = "caa_override_amount", precision = 10, scale = 2)
    private BigDecimal caaOverrideAmount;

    @Column(name = "is_primary_fee", nullable = false)
    @ColumnDefault("false")
    private Boolean primaryFee;
}
