package com.infomedia.abacox.feeschedule.db.entity;

import com.infomedia.abacox.feeschedule.db.entity.superclass.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Group of aircraft types priced alike, e.g. "Light Jet" or "Heavy Turboprop".
 */
@Entity
@Table(
        name = "aircraft_classification",
        uniqueConstraints = @UniqueConstraint(name = "uq_aircraft_classification_name", columnNames = "name")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class AircraftClassification extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "aircraft_classification_id_seq")
    @SequenceGenerator(
            name = "aircraft_classification_id_seq",
            sequenceName = "aircraft_classification_id_seq",
            allocationSize = 1
    )
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "name", length = 100, nullable = false)
    private String name;
}
