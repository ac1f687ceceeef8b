package com.infomedia.abacox.feeschedule.db.entity;

import com.infomedia.abacox.feeschedule.db.entity.superclass.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.util.List;

@Entity
@Table(
        name = "waiver_tier",
        uniqueConstraints = @UniqueConstraint(name = "uq_waiver_tier_priority", columnNames = "tier_priority")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class WaiverTier extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "waiver_tier_id_seq")
    @SequenceGenerator(
            name = "waiver_tier_id_seq",
            sequenceName = "waiver_tier_id_seq",
            allocationSize = 1
    )
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "name", length = 100, nullable = false)
    private String name;

    @Column(name = "fuel_uplift_multiplier", nullable = false, precision = 5, scale = 2)
    private BigDecimal fuelUpliftMultiplier;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "fees_waived_codes", nullable = false)
    private List<String> feesWaivedCodes;

    @Column(name = "tier_priority", nullable = false)
    private Integer tierPriority;

    @Column(name = "is_caa_specific_tier", nullable = false)
    @ColumnDefault("false")
    private Boolean caaSpecificTier;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
