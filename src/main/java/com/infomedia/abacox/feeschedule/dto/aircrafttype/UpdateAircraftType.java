package com.infomedia.abacox.feeschedule.dto.aircrafttype;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.openapitools.jackson.nullable.JsonNullable;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class UpdateAircraftType {
    @NotNull
    @NotBlank
    @Size(max = 100)
    private JsonNullable<String> name = JsonNullable.undefined();

    @NotNull
    private JsonNullable<Long> classificationId = JsonNullable.undefined();

    @NotNull
    @DecimalMin("0")
    private JsonNullable<BigDecimal> baseMinFuelGallonsForWaiver = JsonNullable.undefined();

    @DecimalMin("0")
    private JsonNullable<BigDecimal> defaultMaxGrossWeightLbs = JsonNullable.undefined();
}
