package com.infomedia.abacox.feeschedule.db.entity;

import com.infomedia.abacox.feeschedule.db.entity.superclass.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.ColumnDefault;

import java.math.BigDecimal;

@Entity
@Table(
        name = "aircraft_type",
        uniqueConstraints = @UniqueConstraint(name = "uq_aircraft_type_name", columnNames = "name"),
        indexes = @Index(name = "idx_aircraft_type_classification", columnList = "classification_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class AircraftType extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "aircraft_type_id_seq")
    @SequenceGenerator(
            name = "aircraft_type_id_seq",
            sequenceName = "aircraft_type_id_seq",
            allocationSize = 1
    )
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "name", length = 100, nullable = false)
    private String name;

    @Column(name = "classification_id", nullable = false)
    private Long classificationId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(
            name = "classification_id",
            insertable = false,
            updatable = false,
            foreignKey = @ForeignKey(name = "fk_aircraft_type_classification")
    )
    private AircraftClassification classification;

    /**
     * Fuel quantity, in gallons, that corresponds to a 1.0x uplift. Zero disables fuel waivers.
     */
    @Column(name = "base_min_fuel_gallons_for_waiver", nullable = false, precision = 10, scale = 2)
    @ColumnDefault("0")
    private BigDecimal baseMinFuelGallonsForWaiver;

    @Column(name = "default_max_gross_weight_lbs", precision = 10, scale = 2)
    private BigDecimal defaultMaxGrossWeightLbs;
}
