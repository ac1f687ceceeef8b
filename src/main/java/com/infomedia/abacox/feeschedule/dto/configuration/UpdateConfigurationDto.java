package com.infomedia.abacox.feeschedule.dto.configuration;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Fields left out of the request keep their current value.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UpdateConfigurationDto {
    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal taxRate;

    private Boolean noPrimaryFeesFallback;

    @DecimalMin("0")
    private BigDecimal scheduleUpliftMultiple;
}
