package com.infomedia.abacox.feeschedule.dto.feerule;

import com.infomedia.abacox.feeschedule.component.feeengine.CalculationBasis;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.openapitools.jackson.nullable.JsonNullable;

import java.math.BigDecimal;

/**
 * DTO for updating {@link com.infomedia.abacox.feeschedule.db.entity.FeeRule}
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class UpdateFeeRule {
    @NotNull
    @NotBlank
    @Size(max = 100)
    private JsonNullable<String> feeName = JsonNullable.undefined();

    @NotNull
    @NotBlank
    @Size(max = 50)
    private JsonNullable<String> feeCode = JsonNullable.undefined();

    private JsonNullable<Long> appliesToClassificationId = JsonNullable.undefined();

    @NotNull
    @DecimalMin("0")
    private JsonNullable<BigDecimal> amount = JsonNullable.undefined();

    @NotNull
    @Pattern(regexp = "[A-Z]{3}")
    private JsonNullable<String> currency = JsonNullable.undefined();

    @NotNull
    private JsonNullable<Boolean> taxable = JsonNullable.undefined();

    @NotNull
    private JsonNullable<Boolean> potentiallyWaivableByFuelUplift = JsonNullable.undefined();

    @NotNull
    private JsonNullable<Boolean> manuallyWaivable = JsonNullable.undefined();

    @NotNull
    private JsonNullable<CalculationBasis> calculationBasis = JsonNullable.undefined();

    @NotNull
    private JsonNullable<Boolean> hasCaaOverride = JsonNullable.undefined();

    @DecimalMin("0")
    private JsonNullable<BigDecimal> caaOverrideAmount = JsonNullable.undefined();

    @NotNull
    private JsonNullable<Boolean> primaryFee = JsonNullable.undefined();
}
