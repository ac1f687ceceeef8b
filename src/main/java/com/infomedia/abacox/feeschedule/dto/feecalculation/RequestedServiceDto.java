package com.infomedia.abacox.feeschedule.dto.feecalculation;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RequestedServiceDto {
    @NotBlank
    private String feeCode;

    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal quantity;
}
