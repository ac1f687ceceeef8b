package com.infomedia.abacox.feeschedule.dto.waivertier;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class CreateWaiverTier {
    @NotBlank
    @Size(max = 100)
    private String name;

    @NotNull
    @DecimalMin(value = "0.01")
    @Digits(integer = 3, fraction = 2)
    private BigDecimal fuelUpliftMultiplier;

    @NotEmpty
    private List<@NotBlank String> feesWaivedCodes;

    @Min(1)
    @Schema(description = "defaults to one above the current highest priority")
    private Integer tierPriority;

    @NotNull
    private Boolean caaSpecificTier = false;
}
