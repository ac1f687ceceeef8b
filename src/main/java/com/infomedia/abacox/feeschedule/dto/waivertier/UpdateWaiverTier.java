package com.infomedia.abacox.feeschedule.dto.waivertier;

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
import org.openapitools.jackson.nullable.JsonNullable;

import java.math.BigDecimal;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class UpdateWaiverTier {
    @NotNull
    @NotBlank
    @Size(max = 100)
    private JsonNullable<String> name = JsonNullable.undefined();

    @NotNull
    @DecimalMin(value = "0.01")
    @Digits(integer = 3, fraction = 2)
    private JsonNullable<BigDecimal> fuelUpliftMultiplier = JsonNullable.undefined();

    @NotNull
    @NotEmpty
    private JsonNullable<List<String>> feesWaivedCodes = JsonNullable.undefined();

    @NotNull
    @Min(1)
    private JsonNullable<Integer> tierPriority = JsonNullable.undefined();

    @NotNull
    private JsonNullable<Boolean> caaSpecificTier = JsonNullable.undefined();

    private Long expectedVersion;
}
