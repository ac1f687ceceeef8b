package com.infomedia.abacox.feeschedule.dto.configuration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ConfigurationDto {
    private BigDecimal taxRate;
    private Boolean noPrimaryFeesFallback;
    private BigDecimal scheduleUpliftMultiple;
}
