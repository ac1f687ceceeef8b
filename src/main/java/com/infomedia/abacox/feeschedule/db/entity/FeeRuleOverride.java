package com.infomedia.abacox.feeschedule.db.entity;

import com.infomedia.abacox.feeschedule.db.entity.superclass.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;

/**
 * Classification-level or aircraft-level replacement of a fee rule's amounts. A null amount
 * inherits from the next broader scope.
 */
@Entity
@Table(
        name = "fee_rule_override",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_override_classification_rule", columnNames = {"classification_id", "fee_rule_id"}),
                @UniqueConstraint(name = "uq_override_aircraft_type_rule", columnNames = {"aircraft_type_id", "fee_rule_id"})
        },
        indexes = @Index(name = "idx_fee_rule_override_rule", columnList = "fee_rule_id")
)
@Check(name = "ck_override_target",
        constraints = "(classification_id IS NOT NULL AND aircraft_type_id IS NULL) OR (classification_id IS NULL AND aircraft_type_id IS NOT NULL)")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class FeeRuleOverride extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "fee_rule_override_id_seq")
    @SequenceGenerator(
            name = "fee_rule_override_id_seq",
            sequenceName = "fee_rule_override_id_seq",
            allocationSize = 1
    )
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "fee_rule_id", nullable = false)
    private Long feeRuleId;

    @Column(name = "classification_id")
    private Long classificationId;

    @Column(name = "aircraft_type_id")
    private Long aircraftTypeId;

    @Column(name = "override_amount", precision = 10, scale = 2)
    private BigDecimal overrideAmount;

    @Column(name = "override_caa_amount", precision = 10, scale = 2)
    private BigDecimal overrideCaaAmount;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
