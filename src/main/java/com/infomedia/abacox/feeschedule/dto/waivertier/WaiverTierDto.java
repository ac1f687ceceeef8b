package com.infomedia.abacox.feeschedule.dto.waivertier;

import com.infomedia.abacox.feeschedule.dto.superclass.AuditedDto;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * DTO for {@link com.infomedia.abacox.feeschedule.db.entity.WaiverTier}
 */
@EqualsAndHashCode(callSuper = true)
@Data
@AllArgsConstructor
@NoArgsConstructor
public class WaiverTierDto extends AuditedDto {
    private Long id;
    private String name;
    private BigDecimal fuelUpliftMultiplier;
    private List<String> feesWaivedCodes;
    private Integer tierPriority;
    private Boolean caaSpecificTier;
    private Long version;
}
