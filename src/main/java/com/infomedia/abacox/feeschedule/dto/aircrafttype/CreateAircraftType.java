package com.infomedia.abacox.feeschedule.dto.aircrafttype;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class CreateAircraftType {
    @NotBlank
    @Size(max = 100)
    private String name;

    @NotNull
    private Long classificationId;

    @NotNull
    @DecimalMin("0")
    private BigDecimal baseMinFuelGallonsForWaiver;

    @DecimalMin("0")
    private BigDecimal defaultMaxGrossWeightLbs;
}
