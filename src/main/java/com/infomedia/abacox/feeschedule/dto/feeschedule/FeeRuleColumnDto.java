package com.infomedia.abacox.feeschedule.dto.feeschedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FeeRuleColumnDto {
    private Long feeRuleId;
    private String feeCode;
    private String feeName;
    private String currency;
    private BigDecimal amount;
    private Boolean hasCaaOverride;
    private BigDecimal caaOverrideAmount;
    private Boolean potentiallyWaivableByFuelUplift;
    private Boolean primary;
}
