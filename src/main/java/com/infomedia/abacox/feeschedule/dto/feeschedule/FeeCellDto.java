package com.infomedia.abacox.feeschedule.dto.feeschedule;

import com.infomedia.abacox.feeschedule.component.feeengine.SourceScope;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * DTO for {@link com.infomedia.abacox.feeschedule.component.feeengine.FeeCell}
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class FeeCellDto {
    private Long feeRuleId;
    private String feeCode;
    private BigDecimal finalDisplayValue;
    private Boolean aircraftOverride;
    private SourceScope sourceScope;
    private BigDecimal revertToValue;
    private BigDecimal classificationDefault;
    private BigDecimal globalDefault;
    private BigDecimal finalCaaDisplayValue;
    private Boolean caaAircraftOverride;
    private SourceScope caaSourceScope;
    private BigDecimal revertToCaaValue;
    private BigDecimal classificationCaaDefault;
    private BigDecimal globalCaaDefault;
    private Boolean waived;
    private Boolean caaWaived;
}
