package com.infomedia.abacox.feeschedule.dto.aircrafttype;

import com.infomedia.abacox.feeschedule.dto.aircraftclassification.AircraftClassificationDto;
import com.infomedia.abacox.feeschedule.dto.superclass.AuditedDto;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * DTO for {@link com.infomedia.abacox.feeschedule.db.entity.AircraftType}
 */
@EqualsAndHashCode(callSuper = true)
@Data
@AllArgsConstructor
@NoArgsConstructor
public class AircraftTypeDto extends AuditedDto {
    private Long id;
    private String name;
    private Long classificationId;
    private BigDecimal baseMinFuelGallonsForWaiver;
    private BigDecimal defaultMaxGrossWeightLbs;
    private AircraftClassificationDto classification;
}
