package com.infomedia.abacox.feeschedule.dto.aircraftclassification;

import com.infomedia.abacox.feeschedule.dto.superclass.AuditedDto;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * DTO for {@link com.infomedia.abacox.feeschedule.db.entity.AircraftClassification}
 */
@EqualsAndHashCode(callSuper = true)
@Data
@AllArgsConstructor
@NoArgsConstructor
public class AircraftClassificationDto extends AuditedDto {
    private Long id;
    private String name;
}
