package com.infomedia.abacox.feeschedule.dto.feeruleoverride;

import com.infomedia.abacox.feeschedule.dto.superclass.AuditedDto;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * DTO for {@link com.infomedia.abacox.feeschedule.db.entity.FeeRuleOverride}. A null amount means
 * the scope inherits that amount.
 */
@EqualsAndHashCode(callSuper = true)
@Data
@AllArgsConstructor
@NoArgsConstructor
public class FeeRuleOverrideDto extends AuditedDto {
    private Long id;
    private Long feeRuleId;
    private Long classificationId;
    private Long aircraftTypeId;
    private BigDecimal overrideAmount;
    private BigDecimal overrideCaaAmount;
    private Long version;
}
