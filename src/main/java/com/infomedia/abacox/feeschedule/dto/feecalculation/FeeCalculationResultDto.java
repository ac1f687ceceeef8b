package com.infomedia.abacox.feeschedule.dto.feecalculation;

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
public class FeeCalculationResultDto {
    private Long aircraftTypeId;
    private Boolean caaApplied;
    private BigDecimal upliftRatio;
    private Long waiverTierId;
    private String waiverTierName;
    private List<LineItemDto> lineItems;
    private BigDecimal fuelSubtotal;
    private BigDecimal totalFees;
    private BigDecimal totalWaivers;
    private BigDecimal taxAmount;
    private BigDecimal grandTotal;
}
