package com.infomedia.abacox.feeschedule.dto.feeschedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class AircraftFeeRowDto {
    private Long aircraftTypeId;
    private String aircraftTypeName;
    private Long classificationId;
    private String classificationName;
    private BigDecimal baseMinFuelGallonsForWaiver;
    private List<FeeCellDto> cells;
}
