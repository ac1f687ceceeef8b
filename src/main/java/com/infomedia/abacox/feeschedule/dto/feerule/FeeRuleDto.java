package com.infomedia.abacox.feeschedule.dto.feerule;

import com.infomedia.abacox.feeschedule.component.feeengine.CalculationBasis;
import com.infomedia.abacox.feeschedule.dto.superclass.AuditedDto;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * DTO for {@link com.infomedia.abacox.feeschedule.db.entity.FeeRule}
 */
@EqualsAndHashCode(callSuper = true)
@Data
@AllArgsConstructor
@NoArgsConstructor
public class FeeRuleDto extends AuditedDto {
    private Long id;
    private String feeName;
    private String feeCode;
    private Long appliesToClassificationId;
    private BigDecimal amount;
    private String currency;
    private Boolean taxable;
    private Boolean potentiallyWaivableByFuelUplift;
    private Boolean manuallyWaivable;
    private CalculationBasis calculationBasis;
    private Boolean hasCaaOverride;
    private BigDecimal caaOverrideAmount;
    private Boolean primaryFee;
}
